package com.changelab.mentor.convergence;

import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class TrimLowercaseNormalizer implements IdeaNormalizer {
    @Override
    public String normalize(String idea) {
        return idea == null ? "" : idea.trim().toLowerCase(Locale.ROOT);
    }
}
