package com.qmb.dispatch.cli;

import com.qmb.core.scope.ScopeDecision;
import com.qmb.core.scope.ScopeValidator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: qmb validate &lt;request...&gt;
 * <p>
 * Prints whether a natural-language request is within the model builder's scope.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Check a request against the builder's scope")
@Component
public class ValidateCommand implements Runnable {

    @Parameters(arity = "1..*", description = "Natural language request")
    private List<String> words;

    @Override
    public void run() {
        ScopeDecision decision = ScopeValidator.validate(String.join(" ", words));
        String detail = decision.intent() != null
                ? "intent=" + decision.intent() + ", confidence=" + Math.round(decision.confidence() * 100) + "%"
                : decision.reason();
        ConsoleOutput.scope(decision.allowed(), detail);
        System.out.println("  " + decision.message());
    }
}
