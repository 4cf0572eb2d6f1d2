package com.mediaanalytics.etl.load;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class MonthlyPartitionTest {

    @Test
    void testNameAndRange() {
        MonthlyPartition partition = MonthlyPartition.forDate("user_interactions", LocalDate.of(2025, 3, 17));

        assertThat(partition.name()).isEqualTo("user_interactions_2025_03");
        assertThat(partition.from()).isEqualTo(LocalDate.of(2025, 3, 1));
        assertThat(partition.to()).isEqualTo(LocalDate.of(2025, 4, 1));
    }

    @Test
    void testDecemberRollsOverToNextYear() {
        MonthlyPartition partition = MonthlyPartition.forDate("user_interactions", LocalDate.of(2024, 12, 31));

        assertThat(partition.name()).isEqualTo("user_interactions_2024_12");
        assertThat(partition.to()).isEqualTo(LocalDate.of(2025, 1, 1));
    }

    @Test
    void testCoveringIsDistinctAndOrdered() {
        Set<MonthlyPartition> partitions = MonthlyPartition.covering("user_interactions", Arrays.asList(
            LocalDate.of(2025, 4, 2),
            LocalDate.of(2025, 3, 1),
            LocalDate.of(2025, 3, 31),
            LocalDate.of(2025, 4, 30)));

        assertThat(partitions).extracting(MonthlyPartition::name)
                .containsExactly("user_interactions_2025_03", "user_interactions_2025_04");
    }

    @Test
    void testEqualityIsByTableAndMonth() {
        assertThat(MonthlyPartition.forDate("a", LocalDate.of(2025, 3, 1)))
                .isEqualTo(MonthlyPartition.forDate("a", LocalDate.of(2025, 3, 20)))
                .isNotEqualTo(MonthlyPartition.forDate("b", LocalDate.of(2025, 3, 1)));
    }
}
