package io.github.samzhu.tokenboard.repository;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.repository.query.parser.PartTree;

import io.github.samzhu.tokenboard.document.SubmissionSummary;

class SubmissionSummaryRepositoryTest {

    private static final String LEADERBOARD_QUERY = "findAllByOrderByTotalTokensDescIdAsc";

    @Test
    void leaderboardQueryShouldBreakTiesByUserId() {
        // When: 解析衍生查詢名稱
        Sort sort = new PartTree(LEADERBOARD_QUERY, SubmissionSummary.class).getSort();

        // Then: 同分時依 id 升序，分頁結果穩定
        assertThat(sort).isEqualTo(Sort.by(Sort.Order.desc("totalTokens"), Sort.Order.asc("id")));
    }

    @Test
    void leaderboardQueryShouldBePageable() throws NoSuchMethodException {
        assertThat(SubmissionSummaryRepository.class.getMethod(LEADERBOARD_QUERY, Pageable.class).getReturnType())
            .isEqualTo(List.class);
    }
}
