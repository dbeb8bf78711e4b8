package com.flamingo.ai.orgassistant.service.chunking;

import java.util.List;

/**
 * Separator hierarchies used by {@link RecursiveTextSplitter}, ordered from the coarsest boundary
 * to the finest. Separators are regular expressions; the empty string means "split anywhere".
 */
public enum SplitterLanguage {
  MARKDOWN(
      List.of(
          "\n#{1,6} ",
          "```\n",
          "\n\\*\\*\\*+\n",
          "\n---+\n",
          "\n___+\n",
          "\n\n",
          "\n",
          " ",
          "")),
  PYTHON(List.of("\nclass ", "\ndef ", "\n\tdef ", "\n\n", "\n", " ", "")),
  JAVASCRIPT(
      List.of(
          "\nfunction ",
          "\nconst ",
          "\nlet ",
          "\nvar ",
          "\nclass ",
          "\nif ",
          "\nfor ",
          "\nwhile ",
          "\nswitch ",
          "\ncase ",
          "\ndefault ",
          "\n\n",
          "\n",
          " ",
          "")),
  JAVA(
      List.of(
          "\nclass ",
          "\npublic ",
          "\nprotected ",
          "\nprivate ",
          "\nstatic ",
          "\nif ",
          "\nfor ",
          "\nwhile ",
          "\nswitch ",
          "\ncase ",
          "\n\n",
          "\n",
          " ",
          "")),
  GENERIC(List.of("\n\n", "\n", "\\.", "!", "\\?", ",", " ", ""));

  private final List<String> separators;

  SplitterLanguage(List<String> separators) {
    this.separators = separators;
  }

  public List<String> separators() {
    return separators;
  }
}
