package io.mycelic.core.category;

/**
 * @param parentId  only children of this category
 * @param rootsOnly only categories without a parent; ignored when {@code parentId} is set
 */
public record CategoryQuery(String parentId, boolean rootsOnly) {

    public static CategoryQuery all() {
        return new CategoryQuery(null, false);
    }

    public static CategoryQuery roots() {
        return new CategoryQuery(null, true);
    }

    public static CategoryQuery childrenOf(String parentId) {
        return new CategoryQuery(parentId, false);
    }
}
