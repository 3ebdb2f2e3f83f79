package org.carball.docsim.model.design;

public record EmbedKey(String source, String target) {}
