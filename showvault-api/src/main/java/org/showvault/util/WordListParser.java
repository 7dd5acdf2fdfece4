package org.showvault.util;

import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Comma-separated word lists as typed into the edit form. An empty list means "no filter".
 */
@UtilityClass
public class WordListParser {

    public List<String> parse(String text) {
        if (StringUtils.isBlank(text)) {
            return new ArrayList<>();
        }
        return clean(Arrays.asList(StringUtils.split(text, ',')));
    }

    public List<String> clean(Collection<String> tokens) {
        List<String> result = new ArrayList<>();
        if (tokens == null) {
            return result;
        }
        for (String token : tokens) {
            String trimmed = StringUtils.trimToNull(token);
            if (trimmed != null) {
                result.add(trimmed);
            }
        }
        return result;
    }

    public String join(Collection<String> tokens) {
        return tokens == null ? "" : String.join(", ", tokens);
    }
}
