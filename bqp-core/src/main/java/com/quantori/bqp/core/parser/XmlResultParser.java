package com.quantori.bqp.core.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.quantori.bqp.api.ResultParseException;
import com.quantori.bqp.api.model.Alignment;
import com.quantori.bqp.api.model.BlastProgram;
import com.quantori.bqp.api.model.Hit;
import com.quantori.bqp.api.model.Hsp;
import com.quantori.bqp.api.model.OutputFormat;
import com.quantori.bqp.api.model.Range;
import com.quantori.bqp.api.model.Statistics;
import com.quantori.bqp.core.parser.xml.BlastOutputDocument;
import com.quantori.bqp.core.parser.xml.BlastOutputDocument.HitElement;
import com.quantori.bqp.core.parser.xml.BlastOutputDocument.HspElement;
import com.quantori.bqp.core.parser.xml.BlastOutputDocument.Iteration;
import com.quantori.bqp.core.parser.xml.BlastOutputDocument.StatisticsElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads the NCBI {@code BlastOutput} XML format. Every {@code Hit} element becomes a hit whose
 * primary alignment is its first segment pair.
 */
@Slf4j
public class XmlResultParser implements ResultParser {
  private static final Pattern DOCTYPE = Pattern.compile("<!DOCTYPE[^>]*>");

  private final XmlMapper xmlMapper;

  public XmlResultParser() {
    xmlMapper = new XmlMapper();
    xmlMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    xmlMapper
        .coercionConfigFor(LogicalType.Collection)
        .setAcceptBlankAsEmpty(true)
        .setCoercion(CoercionInputShape.EmptyString, CoercionAction.AsEmpty);
    xmlMapper
        .coercionConfigFor(LogicalType.POJO)
        .setAcceptBlankAsEmpty(true)
        .setCoercion(CoercionInputShape.EmptyString, CoercionAction.AsNull);
  }

  @Override
  public OutputFormat format() {
    return OutputFormat.XML;
  }

  @Override
  public ParsedOutput parse(String body, int queryLength, BlastProgram program) {
    if (StringUtils.isBlank(body)) {
      throw new ResultParseException("XML result is empty");
    }
    BlastOutputDocument document;
    try {
      document =
          xmlMapper.readValue(DOCTYPE.matcher(body).replaceFirst(""), BlastOutputDocument.class);
    } catch (JsonProcessingException e) {
      throw new ResultParseException("XML parsing error: " + e.getOriginalMessage(), e);
    }
    if (document == null) {
      throw new ResultParseException("XML result has no BlastOutput element");
    }
    List<Iteration> iterations = nullToEmpty(document.getIterations());
    if (iterations.isEmpty()) {
      log.debug("XML result has no iterations");
      return ParsedOutput.builder().hits(List.of()).statistics(statistics(document, null)).build();
    }
    Iteration iteration = iterations.get(0);
    int length = firstPositive(iteration.getQueryLength(), document.getQueryLength(), queryLength);
    boolean protein = program != null && program.isProteinScoring();
    int skipped = 0;
    List<Hit> hits = new ArrayList<>();
    for (HitElement element : nullToEmpty(iteration.getHits())) {
      List<Hsp> hsps =
          nullToEmpty(element.getHsps()).stream()
              .filter(Objects::nonNull)
              .map(hsp -> toHsp(hsp, length, protein))
              .collect(Collectors.toList());
      if (hsps.isEmpty()) {
        skipped++;
        continue;
      }
      hits.add(toHit(element, hsps));
    }
    if (skipped > 0) {
      log.warn("Skipped {} XML hits without alignments", skipped);
    }
    if (StringUtils.isNotBlank(iteration.getMessage())) {
      log.debug("Iteration message: {}", iteration.getMessage());
    }
    hits.sort(HitOrdering.DEFAULT);
    return ParsedOutput.builder()
        .hits(hits)
        .statistics(statistics(document, iteration))
        .rejectedLines(skipped)
        .build();
  }

  private static Hit toHit(HitElement element, List<Hsp> hsps) {
    String definition = StringUtils.defaultString(element.getDefinition());
    String accession =
        StringUtils.isNotBlank(element.getAccession())
            ? element.getAccession().trim()
            : HitSupport.accession(StringUtils.defaultString(element.getId()));
    return Hit.fromPrimary(hsps.get(0))
        .accession(accession)
        .description(StringUtils.defaultIfBlank(definition, accession))
        .organism(HitSupport.organism(definition))
        .subjectLength(valueOf(element.getLength()))
        .hsps(List.copyOf(hsps))
        .build();
  }

  private static Hsp toHsp(HspElement hsp, int queryLength, boolean protein) {
    int alignLength = valueOf(hsp.getAlignLength());
    int identity = Math.min(valueOf(hsp.getIdentity()), alignLength);
    int gaps = valueOf(hsp.getGaps());
    String query = StringUtils.defaultString(hsp.getQuerySequence()).trim();
    String subject = StringUtils.defaultString(hsp.getHitSequence()).trim();
    Alignment alignment = Alignment.EMPTY;
    if (!query.isEmpty() && !subject.isEmpty()) {
      String midline = hsp.getMidline();
      if (midline == null || midline.length() != query.length()) {
        midline = MatchLineBuilder.build(query, subject, protein);
      }
      alignment = new Alignment(query, subject, midline);
    }
    return Hsp.builder()
        .bitScore(valueOf(hsp.getBitScore()))
        .rawScore(valueOf(hsp.getScore()))
        .evalue(valueOf(hsp.getEvalue()))
        .identityCount(identity)
        .positiveCount(
            hsp.getPositive() == null ? identity : Math.min(hsp.getPositive(), alignLength))
        .alignmentLength(alignLength)
        .gapCount(gaps)
        .mismatchCount(Math.max(0, alignLength - identity - gaps))
        .identityPercent(HitSupport.percent(identity, alignLength))
        .coveragePercent(HitSupport.coverage(alignLength, queryLength))
        .queryRange(Range.of(valueOf(hsp.getQueryFrom()), valueOf(hsp.getQueryTo())))
        .hitRange(Range.of(valueOf(hsp.getHitFrom()), valueOf(hsp.getHitTo())))
        .alignment(alignment)
        .build();
  }

  private static Statistics statistics(BlastOutputDocument document, Iteration iteration) {
    Statistics.StatisticsBuilder builder =
        Statistics.builder().databaseName(StringUtils.trimToNull(document.getDatabase()));
    StatisticsElement element =
        iteration == null || iteration.getStat() == null
            ? null
            : iteration.getStat().getStatistics();
    if (element != null) {
      builder
          .sequenceCount(valueOf(element.getDatabaseSequences()))
          .letterCount(valueOf(element.getDatabaseLetters()))
          .effectiveSearchSpace(valueOf(element.getEffectiveSearchSpace()))
          .kappa(valueOf(element.getKappa()))
          .lambda(valueOf(element.getLambda()))
          .entropy(valueOf(element.getEntropy()));
    }
    return builder.build();
  }

  private static int firstPositive(Integer first, Integer second, int fallback) {
    if (first != null && first > 0) {
      return first;
    }
    if (second != null && second > 0) {
      return second;
    }
    return fallback;
  }

  private static <T> List<T> nullToEmpty(List<T> list) {
    return list == null ? List.of() : list;
  }

  private static int valueOf(Integer value) {
    return value == null ? 0 : value;
  }

  private static long valueOf(Long value) {
    return value == null ? 0 : value;
  }

  private static double valueOf(Double value) {
    return value == null ? 0 : value;
  }
}
