/**
 * Request and response bodies of the HTTP API.
 *
 * <p>DTOs carry the Jackson and Bean Validation annotations; the domain records they
 * convert to and from carry none.
 *
 * @since 1.0
 */
package com.mosaic.calculator.presentation.dto;
