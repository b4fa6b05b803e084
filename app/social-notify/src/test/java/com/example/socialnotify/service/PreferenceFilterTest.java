/*
 * どこで: PreferenceFilter のユニットテスト
 * 何を: 購読種別によるフィルタ、存在しない受信者のスキップ、一括読み込みを検証する
 * なぜ: 1 件の受信者異常でファンアウト全体が止まらず、フォロワー数ぶんの往復が発生しないことを担保するため
 */
package com.example.socialnotify.service;

import static com.example.socialnotify.service.ServiceFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.socialnotify.model.EventType;
import com.example.socialnotify.model.UserRecord;
import com.example.socialnotify.repository.UserRepository;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(MockitoExtension.class)
class PreferenceFilterTest {

  @Mock private UserRepository userRepository;

  private PreferenceFilter filter;

  @BeforeEach
  void setUp() {
    filter = new PreferenceFilter(userRepository);
  }

  @Test
  void keepsOnlyUsersSubscribedToTheType() {
    when(userRepository.findAllByIds(List.of("user2", "user3")))
        .thenReturn(
            Map.of(
                "user2", user("user2", "priya"),
                "user3", user("user3", "rohit", Set.of(EventType.FOLLOW))));

    final List<UserRecord> result = filter.filter(List.of("user2", "user3"), EventType.LIKE);

    assertThat(result).extracting(UserRecord::userId).containsExactly("user2");
  }

  @Test
  void shareIsNotPartOfTheDefaultSubscription() {
    when(userRepository.findAllByIds(List.of("user2")))
        .thenReturn(Map.of("user2", user("user2", "priya")));

    assertThat(filter.filter(List.of("user2"), EventType.SHARE)).isEmpty();
  }

  @Test
  void missingUsersAreSkippedAndCandidateOrderIsKept() {
    final List<String> candidates = List.of("user5", "ghost", "user4");
    when(userRepository.findAllByIds(candidates))
        .thenReturn(Map.of("user4", user("user4", "maya"), "user5", user("user5", "demo")));

    final List<UserRecord> result = filter.filter(candidates, EventType.COMMENT);

    assertThat(result).extracting(UserRecord::userId).containsExactly("user5", "user4");
  }

  @Test
  void manyFollowersAreLoadedWithOneLookup() {
    final List<String> followers = List.of("user2", "user3", "user4", "user5");
    when(userRepository.findAllByIds(followers))
        .thenReturn(
            Map.of(
                "user2", user("user2", "priya"),
                "user3", user("user3", "rohit"),
                "user4", user("user4", "maya"),
                "user5", user("user5", "demo")));

    assertThat(filter.filter(followers, EventType.POST_CREATE)).hasSize(4);

    verify(userRepository, times(1)).findAllByIds(followers);
    verify(userRepository, never()).findById(any());
  }

  @Test
  void noCandidatesMeansNoLookup() {
    assertThat(filter.filter(List.of(), EventType.LIKE)).isEmpty();

    verifyNoInteractions(userRepository);
  }

  @Test
  void storageFailurePropagatesSoTheEventIsRetried() {
    when(userRepository.findAllByIds(List.of("user2")))
        .thenThrow(new QueryTimeoutException("timeout"));

    assertThatThrownBy(() -> filter.filter(List.of("user2"), EventType.LIKE))
        .isInstanceOf(QueryTimeoutException.class);
  }
}
