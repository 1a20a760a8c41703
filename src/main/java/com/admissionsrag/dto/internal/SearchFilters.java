package com.admissionsrag.dto.internal;

import com.admissionsrag.model.PageType;

public record SearchFilters(String schoolId, PageType pageType) {

    public static SearchFilters none() {
        return new SearchFilters(null, null);
    }

    public static SearchFilters school(String schoolId) {
        return new SearchFilters(schoolId, null);
    }

    public static SearchFilters schoolAndPageType(String schoolId, PageType pageType) {
        return new SearchFilters(schoolId, pageType);
    }

    public boolean hasSchool() {
        return schoolId != null && !schoolId.isBlank();
    }

    public boolean hasPageType() {
        return pageType != null;
    }
}
