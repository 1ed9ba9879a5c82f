package com.flagship.trip_settlement.support;

/**
 * Console sections printed by the tests so a run reads as a walkthrough of each scenario.
 */
public final class TestOutput {

    private TestOutput() {
    }

    public static void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    public static void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    public static void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    public static void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    public static void printExpectedException(String exceptionType, String message) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Exception Message: " + message);
    }
}
