package com.kreasipositif.statementprocessor.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.batch.item.ExecutionContext;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FileRangePartitionerTest {

    @Test
    @DisplayName("Ten files over four partitions: contiguous ranges of three, last one shorter")
    void partition_uneven() {
        Map<String, ExecutionContext> partitions = new FileRangePartitioner(10).partition(4);

        assertThat(partitions).hasSize(4);
        assertRange(partitions.get("partition-0"), 0, 2);
        assertRange(partitions.get("partition-1"), 3, 5);
        assertRange(partitions.get("partition-2"), 6, 8);
        assertRange(partitions.get("partition-3"), 9, 9);
        assertThat(partitions.get("partition-3").getInt("partition")).isEqualTo(3);
    }

    @Test
    @DisplayName("Fewer files than workers yields one partition per file")
    void partition_fewerFilesThanGrid() {
        Map<String, ExecutionContext> partitions = new FileRangePartitioner(2).partition(4);

        assertThat(partitions).containsOnlyKeys("partition-0", "partition-1");
        assertRange(partitions.get("partition-1"), 1, 1);
    }

    @Test
    @DisplayName("No files, no partitions")
    void partition_empty() {
        assertThat(new FileRangePartitioner(0).partition(4)).isEmpty();
    }

    private static void assertRange(ExecutionContext ctx, int start, int end) {
        assertThat(ctx.getInt("startIndex")).isEqualTo(start);
        assertThat(ctx.getInt("endIndex")).isEqualTo(end);
    }
}
