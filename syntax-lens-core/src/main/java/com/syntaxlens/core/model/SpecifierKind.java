package com.syntaxlens.core.model;

/**
 * Binding form of an import specifier.
 */
public enum SpecifierKind {
    /** {@code import React from 'react'} */
    DEFAULT,
    /** {@code import { useState as state } from 'react'} */
    NAMED,
    /** {@code import * as fs from 'fs'} */
    NAMESPACE
}
