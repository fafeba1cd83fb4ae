package com.kreasipositif.statementprocessor.batch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.partition.support.Partitioner;
import org.springframework.batch.item.ExecutionContext;

import java.util.HashMap;
import java.util.Map;

/**
 * Splits the sorted list of statement files into {@code gridSize} contiguous index ranges.
 *
 * <p>Each partition is represented by an {@link ExecutionContext} with the keys:
 * <ul>
 *   <li>{@code startIndex}: first file of this partition (0-based)</li>
 *   <li>{@code endIndex}: last file (inclusive)</li>
 *   <li>{@code partition}: partition number, used to name its report files</li>
 * </ul>
 */
@Slf4j
public class FileRangePartitioner implements Partitioner {

    private final int totalFiles;

    public FileRangePartitioner(int totalFiles) {
        this.totalFiles = totalFiles;
    }

    @Override
    public Map<String, ExecutionContext> partition(int gridSize) {
        Map<String, ExecutionContext> partitions = new HashMap<>();
        if (totalFiles <= 0) {
            log.info("No statement files matched — nothing to partition");
            return partitions;
        }
        int filesPerPartition = (int) Math.ceil((double) totalFiles / gridSize);

        for (int i = 0; i < gridSize; i++) {
            int startIndex = i * filesPerPartition;
            if (startIndex >= totalFiles) break;
            int endIndex = Math.min(startIndex + filesPerPartition, totalFiles) - 1;

            ExecutionContext ctx = new ExecutionContext();
            ctx.putInt("startIndex", startIndex);
            ctx.putInt("endIndex", endIndex);
            ctx.putInt("partition", i);

            String partitionName = "partition-" + i;
            partitions.put(partitionName, ctx);

            log.debug("Partition '{}' — files {}-{}", partitionName, startIndex, endIndex);
        }

        log.info("Created {} partitions for {} statement files (gridSize requested: {})",
                partitions.size(), totalFiles, gridSize);
        return partitions;
    }
}
