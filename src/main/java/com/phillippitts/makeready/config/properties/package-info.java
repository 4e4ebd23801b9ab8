/**
 * Type-safe configuration bound from {@code application.yml}.
 */
package com.phillippitts.makeready.config.properties;
