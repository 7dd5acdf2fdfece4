package org.showvault.util;

import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@UtilityClass
public class ReleaseNameUtils {

    private static final Pattern LEADING_GROUP = Pattern.compile("^\\[([^\\]]+)\\]");
    private static final Pattern TRAILING_GROUP = Pattern.compile("-([A-Za-z0-9]+)(?:\\[[^\\]]*\\])?(?:\\.[A-Za-z0-9]{2,4})?$");
    private static final Pattern SEPARATORS = Pattern.compile("[._\\-\\s]+");

    /**
     * Case-insensitive whole-word match; words are delimited by the string boundary or any
     * non-alphanumeric character, so "dutch" does not match "dutchess".
     */
    public boolean containsWord(String releaseName, String word) {
        if (StringUtils.isAnyBlank(releaseName, word)) {
            return false;
        }
        Pattern pattern = Pattern.compile("(^|[\\W_])" + Pattern.quote(word.trim()) + "($|[\\W_])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return pattern.matcher(releaseName).find();
    }

    public Optional<String> findAnyWord(String releaseName, Collection<String> words) {
        if (words == null) {
            return Optional.empty();
        }
        return words.stream()
                .filter(word -> containsWord(releaseName, word))
                .findFirst();
    }

    /**
     * Release group, either "[Group] Name - 01" (anime style) or "Name.S01E01.720p-GROUP".
     */
    public Optional<String> releaseGroup(String releaseName) {
        if (StringUtils.isBlank(releaseName)) {
            return Optional.empty();
        }
        String trimmed = releaseName.trim();
        Matcher leading = LEADING_GROUP.matcher(trimmed);
        if (leading.find()) {
            return Optional.of(leading.group(1).trim());
        }
        Matcher trailing = TRAILING_GROUP.matcher(trimmed);
        if (trailing.find()) {
            return Optional.of(trailing.group(1));
        }
        return Optional.empty();
    }

    /**
     * Lower-cases and collapses dots, underscores, dashes and whitespace into single spaces.
     */
    public String normalize(String name) {
        if (name == null) {
            return "";
        }
        String withoutGroup = LEADING_GROUP.matcher(name.trim()).replaceFirst("");
        return SEPARATORS.matcher(withoutGroup).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
    }

    public boolean startsWithShowName(String releaseName, String showName) {
        String normalizedShow = normalize(showName);
        if (normalizedShow.isEmpty()) {
            return false;
        }
        String normalizedRelease = normalize(releaseName);
        return normalizedRelease.equals(normalizedShow) || normalizedRelease.startsWith(normalizedShow + " ");
    }
}
