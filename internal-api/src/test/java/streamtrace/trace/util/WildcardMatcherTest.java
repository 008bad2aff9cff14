package streamtrace.trace.util;

import static java.util.Arrays.asList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class WildcardMatcherTest {

  @Test
  void literalMatchIsCaseInsensitive() {
    WildcardMatcher matcher = WildcardMatcher.valueOf("password");
    assertTrue(matcher.matches("password"));
    assertTrue(matcher.matches("PassWord"));
    assertFalse(matcher.matches("password2"));
  }

  @Test
  void starsMatchAnyRun() {
    assertTrue(WildcardMatcher.valueOf("*key").matches("api-key"));
    assertTrue(WildcardMatcher.valueOf("*key").matches("key"));
    assertFalse(WildcardMatcher.valueOf("*key").matches("keys"));
    assertTrue(WildcardMatcher.valueOf("*token*").matches("X-Auth-Token-Id"));
    assertTrue(WildcardMatcher.valueOf("a*c").matches("abbbc"));
    assertTrue(WildcardMatcher.valueOf("*").matches(""));
  }

  @Test
  void regexCharactersAreLiteral() {
    assertTrue(WildcardMatcher.valueOf("jvm.gc.(count)").matches("jvm.gc.(count)"));
    assertFalse(WildcardMatcher.valueOf("jvm.gc.(count)").matches("jvmXgcX(count)"));
    assertTrue(WildcardMatcher.valueOf("a+b?").matches("A+B?"));
  }

  @Test
  void caseSensitivePrefix() {
    WildcardMatcher matcher = WildcardMatcher.valueOf("(?-i)Secret*");
    assertTrue(matcher.matches("SecretValue"));
    assertFalse(matcher.matches("secretvalue"));
    assertEquals("(?-i)Secret*", matcher.toString());
  }

  @Test
  void anyMatchOverList() {
    List<WildcardMatcher> matchers = WildcardMatcher.valuesOf(asList("foo", " ", "*bar"));
    assertEquals(2, matchers.size());
    assertTrue(WildcardMatcher.anyMatch(matchers, "FOO"));
    assertTrue(WildcardMatcher.anyMatch(matchers, "crowbar"));
    assertFalse(WildcardMatcher.anyMatch(matchers, "baz"));
    assertFalse(WildcardMatcher.anyMatch(matchers, null));
    assertTrue(WildcardMatcher.valuesOf(null).isEmpty());
  }
}
