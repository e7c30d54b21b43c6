package io.github.panghy.valkeyvector.schema;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CollectionNamesTest {

  @Test
  void namesDeriveFromCollection() {
    assertThat(CollectionNames.indexName("docs")).isEqualTo("index:docs");
    assertThat(CollectionNames.keyPrefix("docs")).isEqualTo("vdb:docs:");
    assertThat(CollectionNames.key("docs", "42")).isEqualTo("vdb:docs:42");
  }

  @Test
  void collectionOfReversesIndexName() {
    assertThat(CollectionNames.collectionOf("index:docs")).contains("docs");
    assertThat(CollectionNames.collectionOf("index:a:b")).contains("a:b");
    assertThat(CollectionNames.collectionOf("index:")).isEmpty();
    assertThat(CollectionNames.collectionOf("idx_other")).isEmpty();
    assertThat(CollectionNames.collectionOf(null)).isEmpty();
  }

  @Test
  void keyPatternEscapesGlobCharacters() {
    assertThat(CollectionNames.keyPattern("docs")).isEqualTo("vdb:docs:*");
    assertThat(CollectionNames.keyPattern("a*b?[c]")).isEqualTo("vdb:a\\*b\\?\\[c\\]:*");
  }
}
