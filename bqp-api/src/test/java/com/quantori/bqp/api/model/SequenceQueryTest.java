package com.quantori.bqp.api.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class SequenceQueryTest {

  @Test
  void shortSequencePreviewIsTheSequence() {
    var query = SequenceQuery.builder().sequence("ATGCATGCAT").type(SequenceType.DNA).build();
    assertEquals("ATGCATGCAT", query.getPreview());
    assertEquals(10, query.getLength());
  }

  @Test
  void longSequencePreviewIsTruncated() {
    String sequence = "A".repeat(150);
    var query = SequenceQuery.builder().sequence(sequence).type(SequenceType.DNA).build();
    assertEquals("A".repeat(100) + "...", query.getPreview());
    assertEquals(150, query.getLength());
  }

  @Test
  void queryInfoCopiesQuery() {
    var query = SequenceQuery.builder().sequence("MKTAYIAKQR").type(SequenceType.PROTEIN).build();
    QueryInfo info = QueryInfo.of(query);
    assertEquals("MKTAYIAKQR", info.getPreview());
    assertEquals(10, info.getLength());
    assertEquals(SequenceType.PROTEIN, info.getType());
  }
}
