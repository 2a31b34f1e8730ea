package com.autotune.evaluator;

import com.autotune.evaluator.process.CommandResult;
import com.autotune.evaluator.process.CommandRunner;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/** Scripted runner: records every command and answers from a function of the command line. */
class FakeCommandRunner implements CommandRunner {

    private final Function<String, CommandResult> behaviour;
    private final List<String> commands = Collections.synchronizedList(new ArrayList<>());
    volatile int destroyCalls;

    FakeCommandRunner(Function<String, CommandResult> behaviour) {
        this.behaviour = behaviour;
    }

    static CommandResult ok(String output) {
        return new CommandResult(0, output, Duration.ofMillis(5), false, null);
    }

    static CommandResult exit(int code) {
        return new CommandResult(code, "", Duration.ofMillis(5), false, null);
    }

    @Override
    public CommandResult run(String command, Duration timeout) {
        commands.add(command);
        return behaviour.apply(command);
    }

    @Override
    public void destroyAll() {
        destroyCalls++;
    }

    List<String> commands() {
        synchronized (commands) {
            return List.copyOf(commands);
        }
    }

    long count(String prefix) {
        return commands().stream().filter(c -> c.startsWith(prefix)).count();
    }
}
