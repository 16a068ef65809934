package com.cardledger.backend.dto.extraction;

import java.awt.image.BufferedImage;

/**
 * One page image handed to the extractor, with its position in the source document.
 */
public record RenderedPage(String filename, int pageIndex, BufferedImage image) {
}
