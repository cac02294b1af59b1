/**
 * Call lifecycle handlers and the default handler table.
 */
package com.phillippitts.callengine.service.lifecycle;
