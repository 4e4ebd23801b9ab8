/**
 * REST API controllers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/reports} - generates the make-ready report for one survey and
 *       engineering document pair</li>
 * </ul>
 */
package com.phillippitts.makeready.presentation.controller;
