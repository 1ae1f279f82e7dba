package io.apiclient.client;

record User(int id, String name) {}
