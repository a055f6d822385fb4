package com.healthassist.service.builder;

import com.healthassist.common.AdvisoryConstants;
import com.healthassist.model.dto.ai.SymptomQuery;
import com.healthassist.model.knowledge.KnowledgeEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 个性化处理
 * 职责：
 * 1. 基于年龄/性别在知识条目的副本上追加饮食与补充剂建议（规则相互独立、每次全部执行）
 * 2. 生成个性化小贴士
 * 共享规则表只读，这里只会返回新对象
 */
@Slf4j
@Component
public class DietPersonalizer {

    static final String CALCIUM_ITEM = "Calcium-rich foods (dairy, leafy greens, fortified alternatives)";
    static final String VITAMIN_D_ITEM = "Vitamin D3 (2000 IU daily for adults over 50, consult doctor)";
    static final String IRON_ITEM = "Iron-rich foods (lean meats, legumes, fortified cereals)";

    public KnowledgeEntry personalize(KnowledgeEntry entry, SymptomQuery query) {
        List<String> consume = new ArrayList<>(entry.foodsToConsume());
        List<String> supplements = new ArrayList<>(entry.supplements());

        applySeniorRule(query, consume, supplements);
        applyFemaleRule(query, consume);

        return new KnowledgeEntry(entry.category(),
                consume,
                entry.foodsToAvoid(),
                entry.nutritionalFocus(),
                entry.mealSuggestions(),
                supplements);
    }

    /**
     * 个性化小贴士，顺序固定
     */
    public List<String> tips(SymptomQuery query) {
        List<String> tips = new ArrayList<>();
        tips.add(String.format("Keep a symptom diary noting when your %s occurs, how intense it is and what "
                + "you ate or did beforehand.", query.symptom().toLowerCase(Locale.ROOT)));

        if (query.isOlderThan(AdvisoryConstants.SENIOR_AGE_THRESHOLD)) {
            tips.add("After 50, regular check-ups including blood pressure and bone health screening are "
                    + "worth scheduling.");
        }
        if (isFemale(query)) {
            tips.add("Note whether your symptoms follow a monthly pattern and share it with your healthcare provider.");
        }
        if (query.hasMedicalHistory()) {
            tips.add(String.format("Discuss how your medical history (%s) may relate to this symptom with your doctor.",
                    query.medicalHistory().trim()));
        }
        if (AdvisoryConstants.isSevere(query.severity())) {
            tips.add("Because the severity is high, avoid strenuous activity until you have been assessed.");
        }
        tips.add("Introduce dietary changes gradually and note how your symptoms respond.");
        return tips;
    }

    // ================== 个性化规则 ==================

    private void applySeniorRule(SymptomQuery query, List<String> consume, List<String> supplements) {
        if (!query.isOlderThan(AdvisoryConstants.SENIOR_AGE_THRESHOLD)) {
            return;
        }
        if (!mentions(consume, "calcium")) {
            consume.add(CALCIUM_ITEM);
        }
        supplements.add(VITAMIN_D_ITEM);
        log.debug("年龄 {} 超过 {}，追加钙与维生素D建议", query.age(), AdvisoryConstants.SENIOR_AGE_THRESHOLD);
    }

    private void applyFemaleRule(SymptomQuery query, List<String> consume) {
        if (!isFemale(query)) {
            return;
        }
        if (!mentions(consume, "iron-rich")) {
            consume.add(IRON_ITEM);
            log.debug("女性用户，追加富铁食物建议");
        }
    }

    private boolean isFemale(SymptomQuery query) {
        return query.gender() != null && AdvisoryConstants.GENDER_FEMALE.equalsIgnoreCase(query.gender().trim());
    }

    private boolean mentions(List<String> items, String keyword) {
        return items.stream().anyMatch(item -> item.toLowerCase(Locale.ROOT).contains(keyword));
    }
}
