package secops.threatgraph.core.cache;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@Tag("unit")
class KeyPatternsTest {

  @ParameterizedTest
  @CsvSource({
    "rel:threat:T1:*, rel:threat:T1:iocs, true",
    "rel:threat:T1:*, rel:threat:T10:iocs, false",
    "rel:*:threats, rel:actor:A1:threats, true",
    "analytics:org-1:*, analytics:org-2:summary:7d, false",
    "threat:T?, threat:T1, true",
    "ioc:[AB]1, ioc:B1, true",
    "ioc:[AB]1, ioc:C1, false",
    "search.*, search:abc, false"
  })
  void matchesRedisGlob(String pattern, String key, boolean expected) {
    assertThat(KeyPatterns.matches(pattern, key)).isEqualTo(expected);
  }
}
