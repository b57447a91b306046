package com.changelab.mentor.interpreter;

import com.changelab.mentor.interpreter.InterpreterModels.Segmentation;

public interface TextSegmentationStrategy {
    Segmentation segment(String text);
}
