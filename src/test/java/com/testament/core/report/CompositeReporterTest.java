package com.testament.core.report;

import com.testament.core.model.Status;
import com.testament.core.model.TestMethodResult;
import com.testament.core.model.TestSuiteResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class CompositeReporterTest {

    @Test
    @DisplayName("every reporter receives each callback")
    void fansOut() {
        Reporter first = mock(Reporter.class);
        Reporter second = mock(Reporter.class);
        Reporter composite = CompositeReporter.of(first, second);
        var result = new TestMethodResult("testA", Status.PASSED, "").end();

        composite.onSuiteStart("suite_run");
        composite.onTestDone("pkg.Module", result);

        verify(first).onSuiteStart("suite_run");
        verify(second).onSuiteStart("suite_run");
        verify(first).onTestDone("pkg.Module", result);
        verify(second).onTestDone("pkg.Module", result);
    }

    @Test
    @DisplayName("a throwing reporter does not stop the others")
    void isolatesFailures() {
        Reporter broken = mock(Reporter.class);
        Reporter healthy = mock(Reporter.class);
        doThrow(new IllegalStateException("terminal gone")).when(broken).onModuleStart(anyString());
        doThrow(new IllegalStateException("terminal gone")).when(broken).onSuiteStop(any());
        Reporter composite = CompositeReporter.of(broken, healthy);
        var suite = new TestSuiteResult("suite_run").end();

        assertDoesNotThrow(() -> composite.onModuleStart("pkg.Module"));
        assertDoesNotThrow(() -> composite.onSuiteStop(suite));

        verify(healthy).onModuleStart("pkg.Module");
        verify(healthy).onSuiteStop(suite);
    }
}
