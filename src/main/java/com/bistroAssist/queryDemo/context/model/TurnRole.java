package com.bistroAssist.queryDemo.context.model;

public enum TurnRole {
    USER,
    ASSISTANT
}
