package com.github.wikitext.simplified;

import java.util.List;

public record DefinitionListItem(DefinitionListItemType type, List<Spanned<WikitextSimplifiedNode>> content) {}
