package com.cario.catalog.app.service.storage;

/**
 * Maps an image identifier to a readable local file.
 *
 * <p>Throws {@link com.cario.catalog.app.exception.ImageNotFoundException} when nothing is stored
 * under the identifier and {@link com.cario.catalog.app.exception.ImageResolutionException} when
 * the store could not be read.
 */
public interface ImageResolver {

  ResolvedImage resolve(String imageId);
}
