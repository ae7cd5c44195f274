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

import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class LeaderNodeSelectorTest {

  private static final String ELECTION_PATH = "/aurora/scheduler";

  @Rule
  public final ExpectedException exception = ExpectedException.none();

  private final LeaderNodeSelector selector = new LeaderNodeSelector("member_");

  @Test
  public void testLowestSequenceWins() throws Exception {
    final String leader = selector.select(ELECTION_PATH, ImmutableList.of(
        "member_0000000005", "member_0000000002", "member_0000000009"));
    assertThat(leader, equalTo("/aurora/scheduler/member_0000000002"));
  }

  @Test
  public void testSparseSequences() throws Exception {
    final String leader = selector.select(ELECTION_PATH, ImmutableList.of(
        "member_0000000731", "member_0000000044", "member_0000001000"));
    assertThat(leader, equalTo("/aurora/scheduler/member_0000000044"));
  }

  @Test
  public void testNumericNotLexicographic() throws Exception {
    final String leader = selector.select(ELECTION_PATH, ImmutableList.of(
        "member_10", "member_9"));
    assertThat(leader, equalTo("/aurora/scheduler/member_9"));
  }

  @Test
  public void testTieKeepsFirstListed() throws Exception {
    final String leader = selector.select(ELECTION_PATH, ImmutableList.of(
        "member_07", "member_0000000007"));
    assertThat(leader, equalTo("/aurora/scheduler/member_07"));
  }

  @Test
  public void testOtherChildrenIgnored() throws Exception {
    final String leader = selector.select(ELECTION_PATH, ImmutableList.of(
        "lock", "candidate_0000000001", "member_0000000003"));
    assertThat(leader, equalTo("/aurora/scheduler/member_0000000003"));
  }

  @Test
  public void testOtherChildrenWithBadSuffixIgnored() throws Exception {
    final String leader = selector.select(ELECTION_PATH, ImmutableList.of(
        "candidate_abc", "member_0000000003"));
    assertThat(leader, equalTo("/aurora/scheduler/member_0000000003"));
  }

  @Test
  public void testNoChildren() throws Exception {
    exception.expect(LeaderNodeNotFoundException.class);
    exception.expectMessage("no leader node under /aurora/scheduler");
    selector.select(ELECTION_PATH, Collections.<String>emptyList());
  }

  @Test
  public void testNoMembers() throws Exception {
    exception.expect(LeaderNodeNotFoundException.class);
    selector.select(ELECTION_PATH, ImmutableList.of("lock", "leader"));
  }

  @Test
  public void testNonNumericSuffix() throws Exception {
    exception.expect(LeaderNodeSelectionException.class);
    exception.expectMessage("member_abc");
    selector.select(ELECTION_PATH, ImmutableList.of("member_0000000001", "member_abc"));
  }

  @Test
  public void testEmptySuffix() throws Exception {
    exception.expect(LeaderNodeSelectionException.class);
    selector.select(ELECTION_PATH, ImmutableList.of("member_"));
  }

  @Test
  public void testSignedSuffix() throws Exception {
    exception.expect(LeaderNodeSelectionException.class);
    selector.select(ELECTION_PATH, ImmutableList.of("member_-1", "member_0000000001"));
  }

  @Test
  public void testNonAsciiDigitSuffix() throws Exception {
    exception.expect(LeaderNodeSelectionException.class);
    exception.expectMessage("member_\u0661");
    selector.select(ELECTION_PATH, ImmutableList.of("member_0000000005", "member_\u0661"));
  }

  @Test
  public void testFullwidthDigitSuffix() throws Exception {
    exception.expect(LeaderNodeSelectionException.class);
    selector.select(ELECTION_PATH, ImmutableList.of("member_\uFF11", "member_0000000005"));
  }

  @Test
  public void testCustomPrefix() throws Exception {
    final LeaderNodeSelector custom = new LeaderNodeSelector("n_");
    final String leader = custom.select("/election", ImmutableList.of(
        "member_0000000001", "n_0000000004", "n_0000000003"));
    assertThat(leader, equalTo("/election/n_0000000003"));
  }
}
