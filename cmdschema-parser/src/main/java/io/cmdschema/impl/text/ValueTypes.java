package io.cmdschema.impl.text;

import static io.cmdschema.util.TextUtil.lower;

import io.cmdschema.api.ValueType;
import io.cmdschema.internal.HelpPatterns;
import io.cmdschema.util.TextUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/** Keyword-based value type inference. */
public final class ValueTypes {
  private ValueTypes() {}

  /**
   * Infers the value type of a flag from its whole help row. Inline {@code {a,b}} or {@code
   * {a|b}} lists produce a {@link ValueType.Choice} when no stronger keyword matches.
   */
  public static ValueType fromHelpRow(String line) {
    String l = lower(line);
    if (l.contains("file") || l.contains("path")) {
      return ValueType.FILE;
    }
    if (l.contains("dir")) {
      return ValueType.DIRECTORY;
    }
    if (l.contains("url") || l.contains("uri")) {
      return ValueType.URL;
    }
    if (l.contains("num") || l.contains("count")) {
      return ValueType.NUMBER;
    }
    Matcher m = HelpPatterns.CHOICE_VALUES.matcher(line);
    if (m.find()) {
      List<String> choices = new ArrayList<>();
      for (String part : TextUtil.splitAny(m.group(1), ",|")) {
        String value = part.trim();
        if (!value.isEmpty()) {
          choices.add(value);
        }
      }
      if (!choices.isEmpty()) {
        return ValueType.choice(choices);
      }
    }
    return ValueType.STRING;
  }

  /** Infers the type of a positional argument from its placeholder name. */
  public static ValueType fromArgumentName(String name) {
    String l = lower(name);
    if (l.contains("file")) {
      return ValueType.FILE;
    }
    if (l.contains("dir") || l.contains("path")) {
      return ValueType.DIRECTORY;
    }
    if (l.contains("url") || l.contains("uri")) {
      return ValueType.URL;
    }
    if (l.contains("num") || l.contains("count") || l.contains("size")) {
      return ValueType.NUMBER;
    }
    return ValueType.STRING;
  }

  /** Manual-page inference: file/path, dir, url, count/number, otherwise string. */
  public static ValueType fromManText(String text) {
    String l = lower(text);
    if (l.contains("file") || l.contains("path")) {
      return ValueType.FILE;
    }
    if (l.contains("dir")) {
      return ValueType.DIRECTORY;
    }
    if (l.contains("url")) {
      return ValueType.URL;
    }
    if (l.contains("count") || l.contains("num")) {
      return ValueType.NUMBER;
    }
    return ValueType.STRING;
  }
}
