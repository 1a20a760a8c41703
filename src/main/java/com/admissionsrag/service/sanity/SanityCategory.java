package com.admissionsrag.service.sanity;

public enum SanityCategory {

    GPA("gpa"),
    TOEFL("toefl"),
    IELTS("ielts"),
    GRE("gre"),
    COST("cost");

    private final String code;

    SanityCategory(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
