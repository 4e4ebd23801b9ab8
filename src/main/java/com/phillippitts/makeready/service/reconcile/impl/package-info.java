/** Strategy implementations. */
package com.phillippitts.makeready.service.reconcile.impl;
