package com.flamingo.ai.contextlab.service.metadata;

import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.stream.ImageInputStream;
import org.springframework.stereotype.Component;

/**
 * Image format, color mode and dimensions read from the image header through {@link ImageIO}.
 * Formats without an installed reader (WebP on a stock JDK) fail and lose this tier.
 */
@Component
public class ImageMetadataExtractor implements FormatMetadataExtractor {

  @Override
  public FileCategory getCategory() {
    return FileCategory.IMAGE;
  }

  @Override
  public Map<String, Object> extract(Path filePath) throws IOException {
    try (ImageInputStream input = ImageIO.createImageInputStream(filePath.toFile())) {
      if (input == null) {
        throw new IOException("Cannot open image stream for " + filePath);
      }
      Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
      if (!readers.hasNext()) {
        throw new IOException("No image reader available for " + filePath.getFileName());
      }
      ImageReader reader = readers.next();
      try {
        reader.setInput(input, true, true);
        int width = reader.getWidth(0);
        int height = reader.getHeight(0);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("image_format", reader.getFormatName().toUpperCase(Locale.ROOT));
        Iterator<ImageTypeSpecifier> types = reader.getImageTypes(0);
        if (types.hasNext()) {
          metadata.put("image_mode", colorMode(types.next().getColorModel()));
        }
        metadata.put("image_width", width);
        metadata.put("image_height", height);
        metadata.put("image_size", width + "x" + height);
        return metadata;
      } finally {
        reader.dispose();
      }
    }
  }

  /** Maps a color model to a short mode name such as {@code RGB}, {@code RGBA} or {@code L}. */
  static String colorMode(ColorModel model) {
    if (model instanceof IndexColorModel) {
      return "P";
    }
    int colorComponents = model.getNumColorComponents();
    boolean alpha = model.hasAlpha();
    if (colorComponents == 1) {
      return alpha ? "LA" : "L";
    }
    if (colorComponents == 4) {
      return "CMYK";
    }
    return alpha ? "RGBA" : "RGB";
  }
}
