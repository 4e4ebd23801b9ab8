/**
 * Attachment extraction from both source documents and their consolidation into one
 * height-ordered list per pole.
 */
package com.phillippitts.makeready.service.attachment;
