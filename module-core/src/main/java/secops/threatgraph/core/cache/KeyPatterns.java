package secops.threatgraph.core.cache;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Redis glob 패턴({@code * ? [..] \x})을 정규식으로 변환합니다.
 *
 * <p>인메모리 저장소와 L1 패턴 무효화가 Redis와 같은 매칭 규칙을 쓰도록 합니다.
 */
public final class KeyPatterns {

  private static final Map<String, Pattern> COMPILED = new ConcurrentHashMap<>();

  public static boolean matches(String globPattern, String key) {
    return COMPILED.computeIfAbsent(globPattern, KeyPatterns::compile).matcher(key).matches();
  }

  static Pattern compile(String glob) {
    StringBuilder regex = new StringBuilder(glob.length() + 8);
    boolean inClass = false;
    for (int i = 0; i < glob.length(); i++) {
      char c = glob.charAt(i);
      if (c == '\\' && i + 1 < glob.length()) {
        regex.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
        continue;
      }
      if (inClass) {
        if (c == ']') {
          inClass = false;
        }
        regex.append(c);
        continue;
      }
      switch (c) {
        case '*' -> regex.append(".*");
        case '?' -> regex.append('.');
        case '[' -> {
          inClass = true;
          regex.append('[');
        }
        default -> regex.append(Pattern.quote(String.valueOf(c)));
      }
    }
    return Pattern.compile(regex.toString(), Pattern.DOTALL);
  }

  private KeyPatterns() {}
}
