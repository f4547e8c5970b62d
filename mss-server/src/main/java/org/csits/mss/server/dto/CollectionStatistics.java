package org.csits.mss.server.dto;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.Data;

/**
 * 一次收集整理的统计。
 */
@Data
public class CollectionStatistics {

    private Map<String, Integer> categoryCounts = new TreeMap<>();

    private int total;

    private int errors;

    /**
     * 本次归档产生的文件路径，未归档时为空。
     */
    private List<String> storedPaths = new ArrayList<>();

    public void recordProcessed(String category, String storedPath) {
        categoryCounts.merge(category, 1, Integer::sum);
        total++;
        if (storedPath != null && !storedPath.isEmpty()) {
            storedPaths.add(storedPath);
        }
    }

    public void recordError() {
        errors++;
    }

    public int getCount(String category) {
        return categoryCounts.getOrDefault(category, 0);
    }
}
