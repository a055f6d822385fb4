package com.healthassist.model.knowledge;

import java.util.List;

/**
 * 某一症状类别的饮食建议数据
 * 列表在构造时复制为只读视图，实例可在多线程间安全共享
 */
public record KnowledgeEntry(
        String category,
        List<String> foodsToConsume,
        List<String> foodsToAvoid,
        List<String> nutritionalFocus,
        List<String> mealSuggestions,
        List<String> supplements) {

    public KnowledgeEntry {
        foodsToConsume = List.copyOf(foodsToConsume);
        foodsToAvoid = List.copyOf(foodsToAvoid);
        nutritionalFocus = List.copyOf(nutritionalFocus);
        mealSuggestions = List.copyOf(mealSuggestions);
        supplements = List.copyOf(supplements);
    }
}
