package org.islandora.handle;

/**
 * The derivative-generation event that triggered a reconciliation. Only the datastream that was
 * just written is of interest here.
 *
 * @param destinationDsid Id of the datastream that just changed
 */
public record DerivativeHook(String destinationDsid) {

}
