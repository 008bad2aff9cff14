package streamtrace.trace.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * A pattern where {@code *} matches any run of characters, including none. Matching is case
 * insensitive unless the pattern starts with {@code (?-i)}.
 */
public final class WildcardMatcher {
  static final String CASE_SENSITIVE_PREFIX = "(?-i)";

  private final String wildcard;
  private final Pattern pattern;

  private WildcardMatcher(String wildcard, Pattern pattern) {
    this.wildcard = wildcard;
    this.pattern = pattern;
  }

  public static WildcardMatcher valueOf(String wildcard) {
    String body = wildcard;
    int flags = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    if (body.startsWith(CASE_SENSITIVE_PREFIX)) {
      body = body.substring(CASE_SENSITIVE_PREFIX.length());
      flags = 0;
    }
    return new WildcardMatcher(wildcard, Pattern.compile(toRegex(body), flags));
  }

  /** Parses every pattern, skipping blank ones. */
  public static List<WildcardMatcher> valuesOf(@Nullable Collection<String> wildcards) {
    if (wildcards == null || wildcards.isEmpty()) {
      return Collections.emptyList();
    }
    List<WildcardMatcher> matchers = new ArrayList<>(wildcards.size());
    for (String wildcard : wildcards) {
      if (wildcard != null && !wildcard.trim().isEmpty()) {
        matchers.add(valueOf(wildcard.trim()));
      }
    }
    return Collections.unmodifiableList(matchers);
  }

  public static boolean anyMatch(List<WildcardMatcher> matchers, @Nullable CharSequence value) {
    if (value == null) {
      return false;
    }
    for (int i = 0; i < matchers.size(); i++) {
      if (matchers.get(i).matches(value)) {
        return true;
      }
    }
    return false;
  }

  public boolean matches(CharSequence value) {
    return pattern.matcher(value).matches();
  }

  private static String toRegex(String wildcard) {
    StringBuilder sb = new StringBuilder(wildcard.length() + 16);
    int start = 0;
    for (int i = 0; i < wildcard.length(); i++) {
      if (wildcard.charAt(i) == '*') {
        if (i > start) {
          sb.append(Pattern.quote(wildcard.substring(start, i)));
        }
        sb.append(".*");
        start = i + 1;
      }
    }
    if (start < wildcard.length()) {
      sb.append(Pattern.quote(wildcard.substring(start)));
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return wildcard;
  }
}
