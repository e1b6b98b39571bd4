/**
 * Source adapters: thin glue between external sources and the collection framework.
 */
@NullMarked
package org.macroingest.collector.sources;

import org.jspecify.annotations.NullMarked;
