/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.nbframes.reduce;

/// The top two labels of every block, with their summed weights.
///
/// For every cell, `weight1st >= weight2nd >= 0`. A cell with no ranked label holds
/// label 0 and weight 0 in both ranks.
/// @param label1st the label with the largest summed weight
/// @param weight1st its summed weight
/// @param label2nd the label with the second largest summed weight
/// @param weight2nd its summed weight
public record RankedBlocks(
    int[][] label1st,
    double[][] weight1st,
    int[][] label2nd,
    double[][] weight2nd
)
{
}
