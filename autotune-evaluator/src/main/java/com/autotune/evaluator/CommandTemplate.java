package com.autotune.evaluator;

import com.autotune.vartree.space.Valuation;

import java.util.Map;
import java.util.Objects;

/**
 * Shell command with placeholders: {@code %%ID%%} becomes the test id and {@code %name%} the value
 * of the variable {@code name}. Placeholders of inactive variables are left untouched.
 */
public final class CommandTemplate {

    public static final String ID_PLACEHOLDER = "%%ID%%";

    private final String template;

    public CommandTemplate(String template) {
        this.template = Objects.requireNonNull(template, "template");
    }

    public String render(int testId, Valuation valuation) {
        String command = template.replace(ID_PLACEHOLDER, Integer.toString(testId));
        for (Map.Entry<String, String> e : valuation.asMap().entrySet()) {
            command = command.replace("%" + e.getKey() + "%", e.getValue());
        }
        return command;
    }

    public String getTemplate() {
        return template;
    }

    @Override
    public String toString() {
        return template;
    }
}
