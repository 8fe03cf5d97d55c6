/*
 * @LICENSE@
 */

package org.chomsky.automata.test;

import org.chomsky.automata.AlphabetTestCase;
import org.chomsky.automata.BuilderTestCase;
import org.chomsky.automata.CFGTestCase;
import org.chomsky.automata.CFGUtilTestCase;
import org.chomsky.automata.ChomskyTestCase;
import org.chomsky.automata.DFATestCase;
import org.chomsky.automata.DFAUtilTestCase;
import org.chomsky.automata.GNFATestCase;
import org.chomsky.automata.NFATestCase;
import org.chomsky.automata.NFAUtilTestCase;
import org.chomsky.automata.PDATestCase;
import org.chomsky.automata.SubsetConstructionTestCase;
import org.chomsky.automata.TMTestCase;
import org.chomsky.automata.TMUtilTestCase;

import junit.framework.Test;
import junit.framework.TestSuite;

public class AllShort {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(AllShort.suite());
    }

    public static Test suite() {
        TestSuite suite = new TestSuite("Short test suite.");
        //$JUnit-BEGIN$
        suite.addTestSuite(AlphabetTestCase.class);
        suite.addTestSuite(DFATestCase.class);
        suite.addTestSuite(NFATestCase.class);
        suite.addTestSuite(SubsetConstructionTestCase.class);
        suite.addTestSuite(GNFATestCase.class);
        suite.addTestSuite(DFAUtilTestCase.class);
        suite.addTestSuite(NFAUtilTestCase.class);
        suite.addTestSuite(PDATestCase.class);
        suite.addTestSuite(TMTestCase.class);
        suite.addTestSuite(TMUtilTestCase.class);
        suite.addTestSuite(CFGTestCase.class);
        suite.addTestSuite(ChomskyTestCase.class);
        suite.addTestSuite(CFGUtilTestCase.class);
        suite.addTestSuite(BuilderTestCase.class);
        suite.addTestSuite(LogDemoTestCase.class);
        //$JUnit-END$
        return suite;
    }
}
