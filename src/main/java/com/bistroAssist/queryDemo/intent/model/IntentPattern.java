package com.bistroAssist.queryDemo.intent.model;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Keywords and regular expressions that signal one intent.
 */
public record IntentPattern(QueryIntent intent, List<String> keywords, List<Pattern> patterns) {
}
