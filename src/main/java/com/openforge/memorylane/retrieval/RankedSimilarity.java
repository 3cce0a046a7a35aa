package com.openforge.memorylane.retrieval;

import java.time.Instant;

public record RankedSimilarity(String memoryId, double similarity, Instant createdAt) {}
