package com.racelisting.racing.dto;

import com.racelisting.common.query.CompiledQuery;
import com.racelisting.common.query.FilterCompiler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RaceFilterTest {

    private static final String BASE = "SELECT id, meeting_id, name, number, visible, advertised_start_time FROM races";

    @Test
    @DisplayName("meeting ids and visibility compile to IN list plus inlined flag")
    void meetingIdsAndVisibility() {
        RaceFilter filter = RaceFilter.builder().meetingIds(List.of(1L, 2L)).visible(true).build();

        CompiledQuery query = FilterCompiler.compile(BASE, filter);

        assertThat(query.sql()).isEqualTo(BASE + " WHERE meeting_id IN (?,?) AND visible = true");
        assertThat(query.arguments()).containsExactly(1L, 2L);
    }

    @Test
    @DisplayName("id alone compiles to a single placeholder")
    void idOnly() {
        CompiledQuery query = FilterCompiler.compile(BASE, RaceFilter.builder().id(17L).build());

        assertThat(query.sql()).isEqualTo(BASE + " WHERE id = ?");
        assertThat(query.arguments()).containsExactly(17L);
    }

    @Test
    void conditionsFollowDeclaredOrder() {
        RaceFilter filter = new RaceFilter(List.of(3L), false, 9L);

        CompiledQuery query = FilterCompiler.compile(BASE, filter);

        assertThat(query.sql()).isEqualTo(BASE + " WHERE meeting_id IN (?) AND visible = false AND id = ?");
        assertThat(query.arguments()).containsExactly(3L, 9L);
    }

    @Test
    void emptyFilterLeavesQueryUntouched() {
        CompiledQuery query = FilterCompiler.compile(BASE, new RaceFilter(List.of(), null, null));

        assertThat(query.sql()).isEqualTo(BASE);
        assertThat(query.arguments()).isEmpty();
    }
}
