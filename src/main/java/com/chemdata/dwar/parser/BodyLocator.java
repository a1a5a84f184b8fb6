package com.chemdata.dwar.parser;

import com.chemdata.dwar.model.DwarBody;

/**
 * Finds the header row and the data rows in the body of a document.
 */
public interface BodyLocator {

    DwarBody locate(String content);
}
