package com.changelab.mentor.convergence;

@FunctionalInterface
public interface IdeaNormalizer {
    String normalize(String idea);
}
