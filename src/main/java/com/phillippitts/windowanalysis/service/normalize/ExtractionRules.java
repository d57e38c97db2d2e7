package com.phillippitts.windowanalysis.service.normalize;

import com.phillippitts.windowanalysis.domain.FrameMaterial;
import com.phillippitts.windowanalysis.domain.WindowCategory;
import com.phillippitts.windowanalysis.domain.WindowCondition;

import java.util.List;

/**
 * Extraction tables for the categorical window fields, in priority order.
 */
public final class ExtractionRules {

    public static final RuleTable<WindowCategory> CATEGORY = new RuleTable<>(List.of(
            ExtractionRule.word("double[-_ ]?hung", WindowCategory.DOUBLE_HUNG),
            ExtractionRule.word("casements?", WindowCategory.CASEMENT),
            ExtractionRule.word("sliding|slider", WindowCategory.SLIDING),
            ExtractionRule.word("picture", WindowCategory.PICTURE),
            ExtractionRule.word("bay", WindowCategory.BAY),
            ExtractionRule.word("bow", WindowCategory.BOW),
            ExtractionRule.word("awning", WindowCategory.AWNING),
            ExtractionRule.word("hopper", WindowCategory.HOPPER),
            ExtractionRule.word("garden", WindowCategory.GARDEN)
    ), WindowCategory.UNKNOWN);

    public static final RuleTable<FrameMaterial> MATERIAL = new RuleTable<>(List.of(
            ExtractionRule.word("vinyl|pvc|upvc", FrameMaterial.VINYL),
            ExtractionRule.word("wood|wooden", FrameMaterial.WOOD),
            ExtractionRule.word("aluminum|aluminium", FrameMaterial.ALUMINUM),
            ExtractionRule.word("composite", FrameMaterial.COMPOSITE),
            ExtractionRule.word("fiberglass|fibreglass", FrameMaterial.FIBERGLASS)
    ), FrameMaterial.UNKNOWN);

    public static final RuleTable<WindowCondition> CONDITION = new RuleTable<>(List.of(
            ExtractionRule.word("excellent", WindowCondition.EXCELLENT),
            ExtractionRule.word("good", WindowCondition.GOOD),
            ExtractionRule.word("fair", WindowCondition.FAIR),
            ExtractionRule.word("poor", WindowCondition.POOR)
    ), WindowCondition.UNKNOWN);

    private ExtractionRules() {
    }
}
