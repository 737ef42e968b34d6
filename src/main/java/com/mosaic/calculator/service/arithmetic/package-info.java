/**
 * Pure arithmetic operations with explicit domain constraints.
 *
 * @see com.mosaic.calculator.service.arithmetic.ArithmeticEngine
 * @since 1.0
 */
package com.mosaic.calculator.service.arithmetic;
