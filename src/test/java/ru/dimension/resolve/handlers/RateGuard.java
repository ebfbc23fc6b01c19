package ru.dimension.resolve.handlers;

public class RateGuard implements Guard {}
