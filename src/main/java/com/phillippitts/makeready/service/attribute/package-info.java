/**
 * Pole attribute extraction from both documents and conflict resolution between them.
 *
 * <p>{@link com.phillippitts.makeready.service.attribute.AttributeValue} models the two shapes a
 * survey attribute takes: a bare scalar, or a wrapper map whose payload sits under one of
 * several keys checked in priority order.
 */
package com.phillippitts.makeready.service.attribute;
