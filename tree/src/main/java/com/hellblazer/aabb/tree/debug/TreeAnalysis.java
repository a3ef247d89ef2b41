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
package com.hellblazer.aabb.tree.debug;

/**
 * Shape statistics of a tree.
 *
 * @param nodeCount        all nodes
 * @param leafCount        leaves, one per entry
 * @param innerCount       inner nodes, always one less than the leaves of a non-empty tree
 * @param height           height of the root, 0 if empty
 * @param maxAbsBalance    largest height difference between the subtrees of any inner node
 * @param averageLeafDepth mean depth of the leaves, the root being at depth 0
 * @param totalLeafVolume  sum of the volumes of all leaf boxes
 * @param rootVolume       volume of the root bounds, 0 if empty
 * @author hal.hildebrand
 */
public record TreeAnalysis(int nodeCount, int leafCount, int innerCount, int height, int maxAbsBalance,
                           double averageLeafDepth, double totalLeafVolume, double rootVolume) {

    /**
     * How much of the root's volume the leaves account for. Overlapping leaves can push this above 1.
     *
     * @return total leaf volume over root volume, or 0 if the root has no volume
     */
    public double packingRatio() {
        return rootVolume > 0 ? totalLeafVolume / rootVolume : 0;
    }

    @Override
    public String toString() {
        return String.format(
        "TreeAnalysis[nodes=%d, leaves=%d, inner=%d, height=%d, maxBalance=%d, avgLeafDepth=%.2f, packing=%.3f]",
        nodeCount, leafCount, innerCount, height, maxAbsBalance, averageLeafDepth, packingRatio());
    }
}
