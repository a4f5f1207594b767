package org.islandora.handle.config;

/**
 * Association is a record that ties a content model to the datastream that should carry a Handle
 * and the transform used to embed it.
 *
 * @param contentModel Content model id (ex. `islandora:sp_basic_image`)
 * @param datastreamId Datastream that receives the Handle
 * @param transform    Stylesheet applied to the datastream to embed the Handle
 */
public record Association(String contentModel, String datastreamId, String transform) {

}
