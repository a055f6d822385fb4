package com.healthassist.model.knowledge;

/**
 * 可能病因条目，在所属列表中的位置即排名（0 为最可能）
 *
 * @param ageBranch 可选的年龄分支，为 null 表示概率与置信度固定
 */
public record CauseEntry(
        String condition,
        String probability,
        String description,
        String urgency,
        String confidence,
        AgeBranch ageBranch) {

    /**
     * 以单一年龄阈值区分的两组 概率/置信度
     */
    public record AgeBranch(int threshold, Estimate below, Estimate atOrAbove) {

        public Estimate select(int age) {
            return age < threshold ? below : atOrAbove;
        }
    }

    public record Estimate(String probability, String confidence) {
    }
}
