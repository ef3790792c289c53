/**
 * JSON rendering of recognition results with org.json.
 */
package com.phillippitts.fstintent.presentation.json;
