package com.quantori.bqp.core.fallback;

import com.quantori.bqp.api.model.Alignment;
import com.quantori.bqp.api.model.Hit;
import com.quantori.bqp.api.model.Hsp;
import com.quantori.bqp.api.model.QueryInfo;
import com.quantori.bqp.api.model.Range;
import com.quantori.bqp.api.model.ResultSource;
import com.quantori.bqp.api.model.SearchRequest;
import com.quantori.bqp.api.model.SearchResult;
import com.quantori.bqp.api.model.SequenceQuery;
import com.quantori.bqp.api.model.SequenceType;
import com.quantori.bqp.api.model.Statistics;
import com.quantori.bqp.core.parser.HitOrdering;
import com.quantori.bqp.core.parser.MatchLineBuilder;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;

/**
 * Synthesizes a result when a search could not be completed. The result has the shape of a real
 * one but is marked with {@link SearchResult#isRealResults()} false and carries the message of the
 * error that caused it.
 *
 * <p>Generation is deterministic: the same sequence, program and database give the same hits.
 */
@Slf4j
public class FallbackResultGenerator {
  static final double KAPPA = 0.041;
  static final double LAMBDA = 0.267;
  static final double ENTROPY = 0.14;
  static final double DATABASE_SIZE = 1_000_000;
  static final int MIN_HITS = 5;
  static final int HIT_SPREAD = 15;

  private static final String NUCLEOTIDES = "ACGT";
  private static final String AMINO_ACIDS = "ARNDCQEGHILKMFPSTWYV";
  private static final List<String> PROTEIN_FUNCTIONS =
      List.of(
          "DNA-directed RNA polymerase subunit alpha",
          "ATP synthase subunit beta",
          "Ribosomal protein L1",
          "Heat shock protein 70",
          "Elongation factor Tu",
          "DNA gyrase subunit A",
          "Catalase",
          "Superoxide dismutase",
          "Cytochrome c oxidase subunit I",
          "NADH dehydrogenase subunit 1");
  private static final List<String> NUCLEOTIDE_FUNCTIONS =
      List.of(
          "16S ribosomal RNA gene",
          "cytochrome oxidase subunit I gene",
          "internal transcribed spacer",
          "NADH dehydrogenase subunit 1 gene",
          "ATP synthase F0 subunit 6 gene",
          "small subunit ribosomal RNA gene",
          "large subunit ribosomal RNA gene",
          "elongation factor 1-alpha gene",
          "RNA polymerase II largest subunit gene",
          "actin gene");

  public SearchResult generate(
      String searchId,
      SearchRequest request,
      SequenceQuery query,
      String errorMessage,
      Duration elapsed) {
    long seed = seed(query.getSequence(), request);
    Random random = new Random(seed);
    DatabaseProfile profile = DatabaseProfile.of(request.getDatabase());
    boolean protein =
        query.getType() == SequenceType.PROTEIN || profile.isProtein() || isProteinSearch(request);
    int count = Math.min(request.getMaxTargets(), MIN_HITS + (int) Math.floorMod(seed, HIT_SPREAD));

    List<Hit> hits = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      hits.add(hit(i, random, query, profile, protein));
    }
    log.warn(
        "Returning {} simulated hits for search {} after error: {}", count, searchId, errorMessage);
    return SearchResult.builder()
        .searchId(searchId)
        .queryInfo(QueryInfo.of(query))
        .parameters(request)
        .hits(List.copyOf(HitOrdering.sortDefault(hits)))
        .statistics(statistics(request.getDatabase(), profile, query.getLength(), elapsed))
        .source(ResultSource.FALLBACK)
        .realResults(false)
        .errorMessage(errorMessage)
        .completedAt(Instant.now())
        .build();
  }

  static long seed(String sequence, SearchRequest request) {
    return Objects.hash(sequence, request.getProgram(), request.getDatabase()) & 0xffffffffL;
  }

  private static boolean isProteinSearch(SearchRequest request) {
    return request.getProgram() != null && request.getProgram().isProteinScoring();
  }

  private static Hit hit(
      int index, Random random, SequenceQuery query, DatabaseProfile profile, boolean protein) {
    String sequence = query.getSequence();
    int queryLength = sequence.length();
    int alignLength = Math.max(1, (int) (queryLength * (0.6 + random.nextDouble() * 0.3)));
    int queryStart = random.nextInt(queryLength - alignLength + 1);
    String queryPart = sequence.substring(queryStart, queryStart + alignLength);
    String subjectPart =
        mutate(queryPart, random, protein || query.getType() == SequenceType.PROTEIN);
    String matchLine = MatchLineBuilder.build(queryPart, subjectPart, protein);

    int gaps = 0;
    int identities = 0;
    int positives = 0;
    for (int i = 0; i < alignLength; i++) {
      char mark = matchLine.charAt(i);
      if (subjectPart.charAt(i) == '-') {
        gaps++;
      } else if (mark == MatchLineBuilder.IDENTICAL) {
        identities++;
      }
      if (mark != MatchLineBuilder.BLANK) {
        positives++;
      }
    }
    int subjectSpan = alignLength - gaps;
    int subjectLength =
        Math.max(subjectSpan, (int) (queryLength * (0.8 + random.nextDouble() * 0.4)));
    int subjectStart = random.nextInt(subjectLength - subjectSpan + 1);

    double bitScore = Math.max(50, 500 - index * 30 + (random.nextDouble() * 20 - 10));
    String organism = profile.getOrganisms().get(random.nextInt(profile.getOrganisms().size()));
    List<String> functions = protein ? PROTEIN_FUNCTIONS : NUCLEOTIDE_FUNCTIONS;
    String description = functions.get(random.nextInt(functions.size())) + " [" + organism + "]";

    Hsp hsp =
        Hsp.builder()
            .bitScore(bitScore)
            .rawScore(Math.floor(bitScore * 2.2))
            .evalue(KAPPA * queryLength * DATABASE_SIZE * Math.exp(-LAMBDA * bitScore))
            .identityCount(identities)
            .positiveCount(positives)
            .alignmentLength(alignLength)
            .gapCount(gaps)
            .mismatchCount(alignLength - identities - gaps)
            .identityPercent(identities * 100.0 / alignLength)
            .coveragePercent(alignLength * 100.0 / queryLength)
            .queryRange(new Range(queryStart + 1, queryStart + alignLength))
            .hitRange(new Range(subjectStart + 1, subjectStart + Math.max(1, subjectSpan)))
            .alignment(new Alignment(queryPart, subjectPart, matchLine))
            .build();
    return Hit.fromPrimary(hsp)
        .accession(profile.accession(random, index))
        .description(description)
        .organism(organism)
        .subjectLength(subjectLength)
        .hsps(List.of(hsp))
        .build();
  }

  /** Copies the aligned query with occasional gaps and substitutions. */
  private static String mutate(String queryPart, Random random, boolean protein) {
    String alphabet = protein ? AMINO_ACIDS : NUCLEOTIDES;
    int identityTarget = (int) (queryPart.length() * (0.7 + random.nextDouble() * 0.25));
    int gapLimit = (int) (queryPart.length() * (0.02 + random.nextDouble() * 0.05));
    StringBuilder subject = new StringBuilder(queryPart.length());
    int identities = 0;
    int gaps = 0;
    for (int i = 0; i < queryPart.length(); i++) {
      char residue = queryPart.charAt(i);
      if (gaps < gapLimit && random.nextDouble() < 0.02) {
        subject.append('-');
        gaps++;
      } else if (identities < identityTarget && random.nextDouble() < 0.8) {
        subject.append(residue);
        identities++;
      } else {
        char substitute;
        do {
          substitute = alphabet.charAt(random.nextInt(alphabet.length()));
        } while (substitute == residue);
        subject.append(substitute);
      }
    }
    return subject.toString();
  }

  private static Statistics statistics(
      String database, DatabaseProfile profile, int queryLength, Duration elapsed) {
    return Statistics.builder()
        .databaseName(database)
        .sequenceCount(profile.getSequenceCount())
        .letterCount(profile.getLetterCount())
        .searchTimeMillis(elapsed == null ? 0 : elapsed.toMillis())
        .effectiveSearchSpace((double) queryLength * profile.getLetterCount())
        .kappa(KAPPA)
        .lambda(LAMBDA)
        .entropy(ENTROPY)
        .build();
  }
}
