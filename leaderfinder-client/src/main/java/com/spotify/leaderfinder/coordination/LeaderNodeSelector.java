/*-
 * -\-\-
 * Leader Finder Client
 * --
 * Copyright (C) 2016 Spotify AB
 * --
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * -/-/-
 */

package com.spotify.leaderfinder.coordination;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.CharMatcher;
import org.apache.curator.utils.ZKPaths;

/**
 * Picks the leader among the ephemeral-sequential children of an election directory. The
 * member with the lowest sequence number, i.e. the oldest surviving registration, is the
 * leader.
 */
public class LeaderNodeSelector {

  private static final CharMatcher SEQUENCE_DIGITS = CharMatcher.inRange('0', '9');

  private final String memberPrefix;

  public LeaderNodeSelector(final String memberPrefix) {
    checkNotNull(memberPrefix, "memberPrefix");
    checkArgument(!memberPrefix.isEmpty(), "member prefix must not be empty");
    this.memberPrefix = memberPrefix;
  }

  /**
   * Returns the full path of the leader node.
   *
   * <p>Children without the member prefix are ignored. Sequence numbers are compared
   * numerically; if two children carry the same number the first one listed wins.
   *
   * @param electionPath The election directory.
   * @param children     The child names listed under it.
   *
   * @return The path of the child with the lowest sequence number.
   *
   * @throws LeaderNodeNotFoundException  If no child carries the member prefix.
   * @throws LeaderNodeSelectionException If a member child has a non-numeric sequence suffix.
   */
  public String select(final String electionPath, final Iterable<String> children)
      throws LeaderNodeNotFoundException, LeaderNodeSelectionException {
    String leader = null;
    long leaderSequence = Long.MAX_VALUE;

    for (final String child : children) {
      if (!child.startsWith(memberPrefix)) {
        continue;
      }
      final long sequence = sequenceOf(child);
      if (leader == null || sequence < leaderSequence) {
        leader = child;
        leaderSequence = sequence;
      }
    }

    if (leader == null) {
      throw new LeaderNodeNotFoundException("no leader node under " + electionPath);
    }

    return ZKPaths.makePath(electionPath, leader);
  }

  private long sequenceOf(final String child) throws LeaderNodeSelectionException {
    final String suffix = child.substring(memberPrefix.length());
    // ZooKeeper sequence numbers are plain ASCII digits, without sign
    if (suffix.isEmpty() || !SEQUENCE_DIGITS.matchesAllOf(suffix)) {
      throw new LeaderNodeSelectionException("invalid sequence number in member node " + child);
    }
    try {
      return Long.parseLong(suffix);
    } catch (NumberFormatException e) {
      throw new LeaderNodeSelectionException("invalid sequence number in member node " + child, e);
    }
  }
}
