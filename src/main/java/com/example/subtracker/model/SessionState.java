package com.example.subtracker.model;

public enum SessionState {
    UNAUTHENTICATED,
    AUTHENTICATED,
    SUBSCRIBED
}
