package io.cmdschema.impl.man;

import io.cmdschema.impl.IndexedLine;
import io.cmdschema.impl.candidate.CandidatePools;
import io.cmdschema.impl.man.rendered.RenderedManParser;
import io.cmdschema.impl.man.roff.ManMacroParser;
import io.cmdschema.impl.man.roff.MdocParser;
import io.cmdschema.impl.man.roff.RoffLexer;
import io.cmdschema.impl.man.roff.RoffToken;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the manual page pipeline: detection, then the roff lexer and macro parser for raw sources,
 * falling back to the rendered page reader when a roff parse yields nothing.
 */
public final class ManExtractor {
  private static final Logger LOG = LoggerFactory.getLogger(ManExtractor.class);

  private ManExtractor() {}

  /**
   * Collects all manual page candidates.
   *
   * @param command command being parsed
   * @param lines normalized lines
   * @return the bundle, or {@link ManBundle#EMPTY} when the text is not a manual page
   */
  public static ManBundle collectAll(String command, List<IndexedLine> lines) {
    Optional<ManFormat> detected = ManDetector.detect(lines);
    if (detected.isPresent() && detected.get() != ManFormat.RENDERED) {
      ManFormat format = detected.get();
      List<RoffToken> tokens = RoffLexer.tokenize(lines);
      double confidence = ManDetector.confidence(format, lines);
      CandidatePools pools =
          format == ManFormat.MDOC
              ? MdocParser.extract(MdocParser.parse(tokens), confidence)
              : ManMacroParser.extract(ManMacroParser.parse(tokens), confidence);
      ManBundle bundle = toBundle(pools, format);
      if (bundle.hasEntities()) {
        LOG.debug("Roff {} source: {} tokens, confidence {}", format, tokens.size(), confidence);
        return bundle;
      }
      LOG.debug("Roff {} source produced no entities, trying rendered reader", format);
    }
    if (detected.isPresent() || ManDetector.isRenderedManPage(lines)) {
      return toBundle(RenderedManParser.parse(command, lines), ManFormat.RENDERED);
    }
    return ManBundle.EMPTY;
  }

  private static ManBundle toBundle(CandidatePools pools, ManFormat format) {
    return new ManBundle(pools.flags(), pools.subcommands(), pools.args(), format);
  }
}
