/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.gbif.sky.common.image;

import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.DataBufferByte;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;

import javax.imageio.ImageIO;

import com.google.common.io.Files;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads images in any format ImageIO understands and writes PNGs.
 */
@Slf4j
public final class PngCodec {
  private static final String FORMAT = "png";

  private PngCodec() {}

  /**
   * Decodes the image into an RGBA buffer.
   *
   * @throws IOException if the file cannot be read or is in an unknown format
   */
  public static PixelBuffer read(File file) throws IOException {
    BufferedImage image = ImageIO.read(file);
    if (image == null) {
      throw new IOException("Unsupported image format: " + file);
    }
    log.debug("Read {}x{} image from {}", image.getWidth(), image.getHeight(), file);
    return toPixelBuffer(image);
  }

  static PixelBuffer toPixelBuffer(BufferedImage image) {
    int width = image.getWidth();
    int height = image.getHeight();
    Raster raster = image.getRaster();
    int bands = raster.getNumBands();
    boolean eightBitComponents = image.getColorModel() instanceof ComponentColorModel
                                 && raster.getTransferType() == DataBuffer.TYPE_BYTE
                                 && bands >= 1 && bands <= 4;

    PixelBuffer buffer;
    if (eightBitComponents) {
      // samples are taken as is, avoiding any colour space conversion of gray images
      buffer = PixelBuffer.allocate(width, height, Colorspace.forChannels(bands));
      int[] samples = new int[bands];
      for (int y = 0; y < height; y++) {
        for (int x = 0; x < width; x++) {
          raster.getPixel(x, y, samples);
          for (int c = 0; c < bands; c++) {
            buffer.setValue(x, y, c, samples[c]);
          }
        }
      }
      return buffer.convertTo(Colorspace.RGBA);
    }

    buffer = PixelBuffer.allocate(width, height, Colorspace.RGBA);
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        int argb = image.getRGB(x, y);
        buffer.setValue(x, y, 0, (argb >> 16) & 0xFF);
        buffer.setValue(x, y, 1, (argb >> 8) & 0xFF);
        buffer.setValue(x, y, 2, argb & 0xFF);
        buffer.setValue(x, y, 3, (argb >>> 24) & 0xFF);
      }
    }
    return buffer;
  }

  /**
   * Encodes the buffer as a PNG of the same colourspace.
   *
   * @throws IOException if the file cannot be written
   */
  public static void write(PixelBuffer buffer, File file) throws IOException {
    BufferedImage image = toBufferedImage(buffer);
    try (OutputStream out = Files.asByteSink(file).openBufferedStream()) {
      if (!ImageIO.write(image, FORMAT, out)) {
        throw new IOException("No PNG writer available for " + buffer.getColorspace() + " images");
      }
    }
  }

  static BufferedImage toBufferedImage(PixelBuffer buffer) {
    Colorspace colorspace = buffer.getColorspace();
    int channels = colorspace.getChannels();
    ColorSpace space = ColorSpace.getInstance(colorspace.isGrayscale() ? ColorSpace.CS_GRAY : ColorSpace.CS_sRGB);
    boolean alpha = colorspace.hasAlpha();
    ComponentColorModel model = new ComponentColorModel(space, alpha, false,
                                                        alpha ? Transparency.TRANSLUCENT : Transparency.OPAQUE,
                                                        DataBuffer.TYPE_BYTE);
    int[] offsets = new int[channels];
    for (int c = 0; c < channels; c++) {
      offsets[c] = c;
    }
    byte[] data = buffer.toByteArray();
    WritableRaster raster = Raster.createInterleavedRaster(new DataBufferByte(data, data.length),
                                                           buffer.getWidth(), buffer.getHeight(),
                                                           buffer.getWidth() * channels, channels, offsets, null);
    return new BufferedImage(model, raster, false, null);
  }
}
