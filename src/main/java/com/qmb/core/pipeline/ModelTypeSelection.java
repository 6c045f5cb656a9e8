package com.qmb.core.pipeline;

import com.qmb.core.model.ModelType;

/**
 * @param invalidatedStages number of built or approved stages discarded by the selection
 */
public record ModelTypeSelection(ModelType chosen, ModelType recommended, int invalidatedStages) {

    public boolean followsRecommendation() {
        return chosen == recommended;
    }
}
