package com.changelab.mentor.convergence;

import com.changelab.mentor.convergence.ConvergenceModels.Stage;

public class IllegalTransitionException extends RuntimeException {
    public IllegalTransitionException(String operation, Stage stage, String reason) {
        super(operation + " is not allowed in stage " + stage + ": " + reason);
    }
}
