/**
 * Request parameter validation for direct capability actions.
 */
package com.phillippitts.petpal.service.validation;
