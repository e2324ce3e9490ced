package com.example.syncroom.model;

public class Member {
    private final String identity;

    public Member(String identity) {
        this.identity = identity;
    }

    public String getIdentity() { return identity; }
}
