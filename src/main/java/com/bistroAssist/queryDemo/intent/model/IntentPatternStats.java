package com.bistroAssist.queryDemo.intent.model;

public record IntentPatternStats(int keywordCount, int patternCount) {
}
