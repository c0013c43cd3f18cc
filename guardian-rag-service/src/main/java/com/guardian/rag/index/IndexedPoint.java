package com.guardian.rag.index;

import java.util.List;
import java.util.Map;

public record IndexedPoint(String id, List<Double> vector, Map<String, Object> payload) {}
