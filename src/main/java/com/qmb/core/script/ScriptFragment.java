package com.qmb.core.script;

import com.qmb.core.model.StageId;

import java.util.List;

/**
 * Output of one fragment builder.
 *
 * @param tables script table names the fragment loads
 */
public record ScriptFragment(StageId stage, String script, List<String> tables) {

    public ScriptFragment {
        tables = List.copyOf(tables);
    }
}
