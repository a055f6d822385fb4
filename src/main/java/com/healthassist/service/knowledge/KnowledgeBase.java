package com.healthassist.service.knowledge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthassist.common.exception.KnowledgeNotConfiguredException;
import com.healthassist.model.knowledge.CategoryProfile;
import com.healthassist.model.knowledge.CauseEntry;
import com.healthassist.model.knowledge.KnowledgeEntry;
import com.healthassist.model.knowledge.RuleTableDocument;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 症状知识库（进程级只读规则表）
 * 职责：
 * 1. 启动时从 classpath 加载版本化规则表 JSON
 * 2. 校验每个类别的必填字段，缺失即启动失败（不会拖到请求阶段）
 * 3. 对外只暴露不可变的 {@link CategoryProfile}，加载完成后永不修改
 */
@Slf4j
@Component
public class KnowledgeBase {

    public static final String DEFAULT_KEY = "default";

    private final String version;

    // 声明顺序即匹配优先级
    private final List<String> categoryKeys;
    private final Map<String, CategoryProfile> profiles;
    private final CategoryProfile defaultProfile;

    public KnowledgeBase(ObjectMapper objectMapper,
                         @Value("${advisor.knowledge.location:knowledge/symptom-rules.json}") String location) {
        RuleTableDocument document = read(objectMapper, location);
        List<String> problems = validate(document);
        if (!problems.isEmpty()) {
            log.error("知识库规则表校验失败 location={}, problems={}", location, problems);
            throw new KnowledgeNotConfiguredException("Knowledge table '" + location + "' is not configured: "
                    + String.join("; ", problems));
        }

        List<String> general = document.getGeneral_lifestyle() != null
                ? document.getGeneral_lifestyle() : Collections.emptyList();

        Map<String, CategoryProfile> byKey = new LinkedHashMap<>();
        for (RuleTableDocument.Category category : document.getCategories()) {
            String key = category.getKey().trim();
            byKey.put(key, toProfile(key, category, general));
        }

        this.version = document.getVersion();
        this.categoryKeys = List.copyOf(byKey.keySet());
        this.profiles = Collections.unmodifiableMap(byKey);
        this.defaultProfile = toProfile(DEFAULT_KEY, document.getDefaults(), general);

        log.info("知识库加载完成 version={}, categories={}", version, categoryKeys);
    }

    public String version() {
        return version;
    }

    /**
     * 已声明类别，按匹配优先级排序
     */
    public List<String> categoryKeys() {
        return categoryKeys;
    }

    /**
     * 查询类别规则，未知类别返回兜底规则
     */
    public CategoryProfile profile(String key) {
        return profiles.getOrDefault(key, defaultProfile);
    }

    public CategoryProfile defaultProfile() {
        return defaultProfile;
    }

    public boolean isDefault(String key) {
        return DEFAULT_KEY.equals(key) || !profiles.containsKey(key);
    }

    // ================== 加载与转换 ==================

    private RuleTableDocument read(ObjectMapper objectMapper, String location) {
        ClassPathResource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            log.error("知识库规则表不存在: {}", location);
            throw new KnowledgeNotConfiguredException("Knowledge table '" + location + "' was not found on the classpath");
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, RuleTableDocument.class);
        } catch (IOException e) {
            log.error("解析知识库规则表失败: {}", location, e);
            throw new KnowledgeNotConfiguredException("Knowledge table '" + location + "' could not be parsed", e);
        }
    }

    private CategoryProfile toProfile(String key, RuleTableDocument.Category category, List<String> general) {
        RuleTableDocument.Diet diet = category.getDiet();
        KnowledgeEntry entry = new KnowledgeEntry(key,
                diet.getFoods_to_consume(),
                diet.getFoods_to_avoid(),
                diet.getNutritional_focus(),
                diet.getMeal_suggestions(),
                diet.getSupplements());

        List<CauseEntry> causes = category.getCauses().stream()
                .map(this::toCause)
                .toList();

        // 通用建议在前，类别专属建议在后
        List<String> lifestyle = new ArrayList<>(general);
        if (category.getLifestyle() != null) {
            lifestyle.addAll(category.getLifestyle());
        }
        return new CategoryProfile(key, entry, causes, lifestyle, category.getRed_flags());
    }

    private CauseEntry toCause(RuleTableDocument.Cause cause) {
        CauseEntry.AgeBranch branch = null;
        RuleTableDocument.AgeBranch doc = cause.getAge_branch();
        if (doc != null) {
            branch = new CauseEntry.AgeBranch(doc.getThreshold(),
                    new CauseEntry.Estimate(doc.getBelow().getProbability(), doc.getBelow().getConfidence()),
                    new CauseEntry.Estimate(doc.getAt_or_above().getProbability(), doc.getAt_or_above().getConfidence()));
        }
        return new CauseEntry(cause.getCondition(), cause.getProbability(), cause.getDescription(),
                cause.getUrgency(), cause.getConfidence(), branch);
    }

    // ================== 校验 ==================

    private List<String> validate(RuleTableDocument document) {
        List<String> problems = new ArrayList<>();
        if (document == null) {
            problems.add("document is empty");
            return problems;
        }
        if (StringUtils.isBlank(document.getVersion())) {
            problems.add("version is missing");
        }
        if (document.getCategories() == null || document.getCategories().isEmpty()) {
            problems.add("no categories declared");
        } else {
            List<String> seen = new ArrayList<>();
            for (int i = 0; i < document.getCategories().size(); i++) {
                RuleTableDocument.Category category = document.getCategories().get(i);
                String key = category == null ? null : category.getKey();
                String label = StringUtils.isBlank(key) ? "categories[" + i + "]" : key;
                if (category == null) {
                    problems.add(label + " is null");
                    continue;
                }
                if (StringUtils.isBlank(key)) {
                    problems.add(label + ".key is missing");
                } else {
                    String trimmed = key.trim();
                    if (!trimmed.equals(trimmed.toLowerCase(Locale.ROOT))) {
                        problems.add(label + ".key must be lower case");
                    }
                    if (DEFAULT_KEY.equals(trimmed)) {
                        problems.add(label + ".key is reserved");
                    }
                    if (seen.contains(trimmed)) {
                        problems.add(label + ".key is declared twice");
                    }
                    seen.add(trimmed);
                }
                validateCategory(label, category, problems);
            }
        }
        requireItems("general_lifestyle", document.getGeneral_lifestyle(), problems);
        if (document.getDefaults() == null) {
            problems.add("default entry is missing");
        } else {
            validateCategory(DEFAULT_KEY, document.getDefaults(), problems);
        }
        return problems;
    }

    private void validateCategory(String label, RuleTableDocument.Category category, List<String> problems) {
        RuleTableDocument.Diet diet = category.getDiet();
        if (diet == null) {
            problems.add(label + ".diet is missing");
        } else {
            requireList(label + ".diet.foods_to_consume", diet.getFoods_to_consume(), problems);
            requireList(label + ".diet.foods_to_avoid", diet.getFoods_to_avoid(), problems);
            requireList(label + ".diet.nutritional_focus", diet.getNutritional_focus(), problems);
            requireList(label + ".diet.meal_suggestions", diet.getMeal_suggestions(), problems);
            requireList(label + ".diet.supplements", diet.getSupplements(), problems);
        }
        requireList(label + ".red_flags", category.getRed_flags(), problems);
        requireItems(label + ".lifestyle", category.getLifestyle(), problems);

        if (category.getCauses() == null || category.getCauses().isEmpty()) {
            problems.add(label + ".causes is missing or empty");
            return;
        }
        for (int i = 0; i < category.getCauses().size(); i++) {
            validateCause(label + ".causes[" + i + "]", category.getCauses().get(i), problems);
        }
    }

    private void validateCause(String label, RuleTableDocument.Cause cause, List<String> problems) {
        if (cause == null) {
            problems.add(label + " is null");
            return;
        }
        requireText(label + ".condition", cause.getCondition(), problems);
        requireText(label + ".probability", cause.getProbability(), problems);
        requireText(label + ".description", cause.getDescription(), problems);
        requireText(label + ".urgency", cause.getUrgency(), problems);
        requireText(label + ".confidence", cause.getConfidence(), problems);

        RuleTableDocument.AgeBranch branch = cause.getAge_branch();
        if (branch == null) {
            return;
        }
        if (branch.getThreshold() == null || branch.getThreshold() <= 0) {
            problems.add(label + ".age_branch.threshold must be positive");
        }
        validateEstimate(label + ".age_branch.below", branch.getBelow(), problems);
        validateEstimate(label + ".age_branch.at_or_above", branch.getAt_or_above(), problems);
    }

    private void validateEstimate(String label, RuleTableDocument.Estimate estimate, List<String> problems) {
        if (estimate == null) {
            problems.add(label + " is missing");
            return;
        }
        requireText(label + ".probability", estimate.getProbability(), problems);
        requireText(label + ".confidence", estimate.getConfidence(), problems);
    }

    private void requireList(String label, List<String> values, List<String> problems) {
        if (values == null || values.isEmpty()) {
            problems.add(label + " is missing or empty");
        } else if (values.stream().anyMatch(StringUtils::isBlank)) {
            problems.add(label + " contains a blank item");
        }
    }

    /**
     * 可选列表，允许缺省或为空，但不允许空白项
     */
    private void requireItems(String label, List<String> values, List<String> problems) {
        if (values != null && values.stream().anyMatch(StringUtils::isBlank)) {
            problems.add(label + " contains a blank item");
        }
    }

    private void requireText(String label, String value, List<String> problems) {
        if (StringUtils.isBlank(value)) {
            problems.add(label + " is missing");
        }
    }
}
