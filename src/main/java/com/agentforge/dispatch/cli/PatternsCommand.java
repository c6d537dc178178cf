package com.agentforge.dispatch.cli;

import com.agentforge.core.model.PatternKind;
import com.agentforge.core.orchestration.StrategyFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: agentforge patterns
 */
@Command(name = "patterns", mixinStandardHelpOptions = true, description = "List orchestration patterns")
@Component
public class PatternsCommand implements Runnable {

    private final StrategyFactory strategyFactory;

    public PatternsCommand(StrategyFactory strategyFactory) {
        this.strategyFactory = strategyFactory;
    }

    @Override
    public void run() {
        for (PatternKind kind : PatternKind.values()) {
            if (strategyFactory.isSupported(kind)) {
                ConsoleOutput.success(kind.tag());
            } else {
                ConsoleOutput.error(kind.tag() + " (not implemented)");
            }
        }
    }
}
