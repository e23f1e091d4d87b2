/**
 * Maps exceptions escaping controllers to HTTP status codes.
 */
package com.phillippitts.factopinion.presentation.exception;
