package com.changelab.mentor.strategy;

import com.changelab.mentor.context.FocusContext;

@FunctionalInterface
public interface PromptBuilder {
    String build(FocusContext context);
}
