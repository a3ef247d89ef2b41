/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the AABB Tree.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.aabb.tree;

import com.hellblazer.aabb.geometry.Box3f;
import com.hellblazer.aabb.geometry.BoxNd;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class TreeConfigTest {

    @Test
    public void testDefaults() {
        var config = TreeConfig.<String>forBox3f();
        assertSame(Box3f.NaN, config.getEmptyBounds());
        assertEquals("  ", config.getIndent());
        assertTrue(config.getEquality().test("a", "a"));
        assertTrue(config.getEquality().test(null, null));
        assertFalse(config.getEquality().test("a", "b"));
        assertEquals(AABBTree.class.desiredAssertionStatus(), config.isValidateOnMutation());
        assertFalse(config.isStrictBounds());
    }

    @Test
    public void testFluent() {
        var config = TreeConfig.<String>forBoxNd(2)
                               .withIndent("--")
                               .withEquality(String::equalsIgnoreCase)
                               .withValidation(false)
                               .withStrictBounds(true);
        assertEquals("--", config.getIndent());
        assertTrue(config.getEquality().test("ABC", "abc"));
        assertFalse(config.isValidateOnMutation());
        assertTrue(config.isStrictBounds());
        assertTrue(config.debugging().isValidateOnMutation());
        assertEquals(2, config.getEmptyBounds().dimension());
    }

    @Test
    public void testInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new TreeConfig<Box3f, String>(null));
        assertThrows(IllegalArgumentException.class,
                     () -> new TreeConfig<Box3f, String>(Box3f.of(0, 0, 0, 1, 1, 1)));
        assertThrows(IllegalArgumentException.class, () -> TreeConfig.<String>forBox3f().withIndent(null));
        assertThrows(IllegalArgumentException.class, () -> TreeConfig.<String>forBox3f().withEquality(null));
        assertThrows(IllegalArgumentException.class, () -> TreeConfig.<String>forBoxNd(0));
        assertThrows(IllegalArgumentException.class, () -> new AABBTree<BoxNd, String>(null));
    }
}
