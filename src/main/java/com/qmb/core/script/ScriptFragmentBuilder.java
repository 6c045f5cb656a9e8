package com.qmb.core.script;

import com.qmb.core.model.StageId;

/**
 * Generates the script fragment of a single stage.
 */
public interface ScriptFragmentBuilder {

    StageId stage();

    ScriptFragment build(BuildContext context);
}
