package com.aikb.rag.model;

public record UserProfile(String name, String department, String role) {

    public static final UserProfile ANONYMOUS = new UserProfile("Anonymous", "General", "VIEWER");
}
