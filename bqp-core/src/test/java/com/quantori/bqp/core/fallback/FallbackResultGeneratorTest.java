package com.quantori.bqp.core.fallback;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.quantori.bqp.api.model.BlastProgram;
import com.quantori.bqp.api.model.Hit;
import com.quantori.bqp.api.model.ResultSource;
import com.quantori.bqp.api.model.SearchRequest;
import com.quantori.bqp.api.model.SearchResult;
import com.quantori.bqp.api.model.SequenceQuery;
import com.quantori.bqp.api.model.ServiceType;
import com.quantori.bqp.core.parser.HitOrdering;
import com.quantori.bqp.core.sequence.SequenceValidator;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class FallbackResultGeneratorTest {
  private static final String SEQUENCE = "ATGCGTACGTTAGCATGCGTACGTTAGCATGCGTACGTTAGC";

  private final FallbackResultGenerator generator = new FallbackResultGenerator();

  @Test
  void resultIsMarkedAsSimulated() {
    SearchResult result = generate(request("nt", 50), "connection refused");

    assertEquals(ResultSource.FALLBACK, result.getSource());
    assertFalse(result.isRealResults());
    assertEquals("connection refused", result.getErrorMessage());
    assertEquals("nt", result.getStatistics().getDatabaseName());
  }

  @Test
  void sameInputGivesSameHits() {
    List<String> first = describe(generate(request("nt", 50), "a"));
    List<String> second = describe(generate(request("nt", 50), "b"));
    List<String> otherDatabase = describe(generate(request("refseq_rna", 50), "a"));

    assertEquals(first, second);
    assertNotEquals(first, otherDatabase);
  }

  @Test
  void hitCountRespectsMaxTargets() {
    SearchResult result = generate(request("nt", 3), "error");

    assertThat(result.getHits().size(), is(3));
  }

  @Test
  void hitsAreConsistentAndRanked() {
    List<Hit> hits = generate(request("nt", 50), "error").getHits();

    assertThat(hits.size(), greaterThanOrEqualTo(FallbackResultGenerator.MIN_HITS));
    assertEquals(HitOrdering.sortDefault(hits), hits);
    assertThat(
        hits.stream().map(Hit::getBitScore).collect(Collectors.toList()),
        everyItem(greaterThanOrEqualTo(50.0)));
    for (Hit hit : hits) {
      assertThat(hit.getQueryRange().getTo(), lessThanOrEqualTo(SEQUENCE.length()));
      assertEquals(hit.getAlignmentLength(), hit.getAlignment().getQuery().length());
      assertEquals(
          hit.getAlignmentLength(),
          hit.getIdentityCount() + hit.getMismatchCount() + hit.getGapCount());
      assertTrue(hit.getAccession().startsWith("N"), hit.getAccession());
    }
  }

  @Test
  void accessionPatternsFollowDatabase() {
    Hit swissprot =
        generator
            .generate("s", proteinRequest(), SequenceValidator.validate("MKTAYIAKQRQISFVKSHFSRQ"),
                "error", Duration.ZERO)
            .getHits()
            .get(0);

    assertTrue(swissprot.getAccession().matches("[PQO]\\d{5}"), swissprot.getAccession());
  }

  private SearchResult generate(SearchRequest request, String error) {
    SequenceQuery query = SequenceValidator.validate(request.getSequence());
    return generator.generate("BLAST_test", request, query, error, Duration.ofMillis(5));
  }

  private static SearchRequest request(String database, int maxTargets) {
    return SearchRequest.builder()
        .sequence(SEQUENCE)
        .program(BlastProgram.BLASTN)
        .service(ServiceType.REMOTE)
        .database(database)
        .maxTargets(maxTargets)
        .build();
  }

  private static SearchRequest proteinRequest() {
    return SearchRequest.builder()
        .sequence("MKTAYIAKQRQISFVKSHFSRQ")
        .program(BlastProgram.BLASTP)
        .service(ServiceType.REMOTE)
        .database("swissprot")
        .build();
  }

  private static List<String> describe(SearchResult result) {
    return result.getHits().stream()
        .map(hit -> hit.getAccession() + " " + hit.getBitScore() + " " + hit.getDescription())
        .collect(Collectors.toList());
  }
}
