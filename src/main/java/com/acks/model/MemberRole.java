package com.acks.model;

public enum MemberRole {
    MEMBER,
    HENCHMAN
}
