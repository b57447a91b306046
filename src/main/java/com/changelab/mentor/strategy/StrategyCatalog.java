package com.changelab.mentor.strategy;

import java.util.List;

public interface StrategyCatalog {
    List<StrategyDescriptor> descriptors();
}
