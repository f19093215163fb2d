package com.afterlands.aftercodec.core.format;

import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.PluralCategory;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.model.Translation;

import java.util.List;
import java.util.Map;

/**
 * Shared fixtures for format tests.
 */
final class FormatTestSupport {

    private FormatTestSupport() {
    }

    /**
     * One Singular and one Plural {one, other} entry in {@code language}.
     */
    static Resource singularAndPlural(String language) {
        return Resource.of(List.of(
                Entry.of("welcome", language, "Welcome, \"friend\"!\nEnjoy & relax"),
                Entry.of("items", language, Translation.plural(Map.of(
                        PluralCategory.ONE, "%d item",
                        PluralCategory.OTHER, "%d items")))
        ));
    }
}
